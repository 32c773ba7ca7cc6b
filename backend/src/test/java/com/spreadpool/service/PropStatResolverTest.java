package com.spreadpool.service;

import com.spreadpool.model.PropBet;
import com.spreadpool.model.PropDomain;
import com.spreadpool.model.PropOutcome;
import com.spreadpool.provider.GameSummary;
import com.spreadpool.support.SummaryFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PropStatResolverTest {

    private static final GameSummary GAME = SummaryFixtures.summary("401", "summary-401.json");

    private final PropStatResolver resolver = new PropStatResolver();

    private Optional<PropOutcome> resolve(String description, PropDomain domain) {
        return resolver.resolve(new PropBet(null, "AFC", description, domain), GAME);
    }

    @Test
    void playerLinesCompareTheBoxScoreStat() {
        assertThat(resolve("Josh Allen (BUF) Passing Yards (Line: 274.5)", PropDomain.OVER_UNDER)).hasValue(PropOutcome.OVER);
        assertThat(resolve("Travis Kelce (KC) Receptions (Line: 8.5)", PropDomain.OVER_UNDER)).hasValue(PropOutcome.UNDER);
        assertThat(resolve("Isiah Pacheco (KC) Rushing Yards (Line: 49.5)", PropDomain.OVER_UNDER)).hasValue(PropOutcome.OVER);
        assertThat(resolve("Khalil Shakir (BUF) Receiving Yards (Line: 90.5)", PropDomain.OVER_UNDER)).hasValue(PropOutcome.UNDER);
        assertThat(resolve("Matt Milano (BUF) Tackles (Line: 7.5)", PropDomain.OVER_UNDER)).hasValue(PropOutcome.OVER);
        assertThat(resolve("Khalil Shakir (BUF) Longest Reception Over/Under 25.5", PropDomain.OVER_UNDER)).hasValue(PropOutcome.OVER);
    }

    @Test
    void rushingPlusReceivingCountsAMissingGroupAsZero() {
        assertThat(resolve("James Cook (BUF) Rushing + Receiving Yards (Line: 60.5)", PropDomain.OVER_UNDER))
                .hasValue(PropOutcome.OVER);
    }

    @Test
    void statEqualToTheLineStaysOpen() {
        assertThat(resolve("Patrick Mahomes (KC) Passing TDs (Line: 3)", PropDomain.OVER_UNDER)).isEmpty();
    }

    @Test
    void playerMissingFromTheBoxScoreStaysOpen() {
        assertThat(resolve("Jaylen Waddle (MIA) Receiving Yards (Line: 60.5)", PropDomain.OVER_UNDER)).isEmpty();
        assertThat(resolve("Jaylen Waddle (MIA) Anytime Touchdown Scorer", PropDomain.YES_NO)).isEmpty();
    }

    @Test
    void teamDefenseSacksComeFromTheOpposingPassers() {
        assertThat(resolve("Chiefs Defense: Total Team Sacks (Line: 2.5)", PropDomain.OVER_UNDER)).hasValue(PropOutcome.OVER);
        assertThat(resolve("Bills Defense: Total Team Sacks (Line: 2.5)", PropDomain.OVER_UNDER)).hasValue(PropOutcome.UNDER);
        assertThat(resolve("Total Sacks - Both Teams (Line: 4.5)", PropDomain.OVER_UNDER)).hasValue(PropOutcome.OVER);
    }

    @Test
    void gameTotals() {
        Map<String, PropOutcome> expected = Map.of(
                "Total Interceptions (Line: 0.5)", PropOutcome.OVER,
                "Largest Lead (Line: 13.5)", PropOutcome.OVER,
                "4th Down Conversions - Both Teams (Line: 0.5)", PropOutcome.OVER,
                "Total Made Field Goals (Line: 3.5)", PropOutcome.UNDER);
        expected.forEach((description, outcome) ->
                assertThat(resolve(description, PropDomain.OVER_UNDER)).as(description).hasValue(outcome));
    }

    @Test
    void yesNoFacts() {
        Map<String, PropOutcome> expected = Map.of(
                "Josh Allen (BUF) Anytime Touchdown Scorer", PropOutcome.YES,
                "James Cook (BUF) Rushing TD - Will he score?", PropOutcome.NO,
                "First Score of the game a Touchdown?", PropOutcome.NO,
                "Defensive or Special Teams TD scored?", PropOutcome.NO,
                "Will the game go to Overtime?", PropOutcome.NO,
                "Longest Field Goal made longer than 47.5 yards?", PropOutcome.YES,
                "Shortest TD of the game shorter than 1.5 yards?", PropOutcome.YES,
                "Opening Kickoff a Touchback?", PropOutcome.YES,
                "Final Play of the game a QB knee?", PropOutcome.YES);
        expected.forEach((description, outcome) ->
                assertThat(resolve(description, PropDomain.YES_NO)).as(description).hasValue(outcome));
    }

    @Test
    void yesNoFactsNeedAYesNoProp() {
        assertThat(resolve("Will the game go to Overtime?", PropDomain.OVER_UNDER)).isEmpty();
    }

    @Test
    void unknownWordingStaysOpen() {
        for (String description : List.of("Most Penalties", "Coin toss result", "")) {
            assertThat(resolve(description, PropDomain.YES_NO)).as(description).isEmpty();
        }
    }

    @Test
    void descriptionParsing() {
        assertThat(PropStatResolver.playerName("Josh Allen (BUF) Passing Yards (Line: 274.5)")).hasValue("Josh Allen");
        assertThat(PropStatResolver.playerName("Total Interceptions (Line: 0.5)")).isEmpty();
        assertThat(PropStatResolver.line("Josh Allen (BUF) Passing Yards (Line: 274.5)")).hasValue(274.5);
        assertThat(PropStatResolver.line("Longest Reception Over/Under 25.5")).hasValue(25.5);
        assertThat(PropStatResolver.line("Will the game go to Overtime?")).isEmpty();
    }
}
