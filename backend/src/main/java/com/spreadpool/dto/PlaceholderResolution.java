package com.spreadpool.dto;

import java.math.BigDecimal;

public class PlaceholderResolution {
    private String homeTeam;
    private String awayTeam;
    private String favoriteTeam; // optional, with spreadPts
    private BigDecimal spreadPts;

    public String getHomeTeam() { return homeTeam; }
    public void setHomeTeam(String homeTeam) { this.homeTeam = homeTeam; }

    public String getAwayTeam() { return awayTeam; }
    public void setAwayTeam(String awayTeam) { this.awayTeam = awayTeam; }

    public String getFavoriteTeam() { return favoriteTeam; }
    public void setFavoriteTeam(String favoriteTeam) { this.favoriteTeam = favoriteTeam; }

    public BigDecimal getSpreadPts() { return spreadPts; }
    public void setSpreadPts(BigDecimal spreadPts) { this.spreadPts = spreadPts; }
}
