package com.myscrollr.delivery.routing;

/**
 * Table names as they appear in change records.
 */
public final class CdcTables {

    public static final String TRADES = "trades";
    public static final String GAMES = "games";
    public static final String RSS_ITEMS = "rss_items";
    public static final String USER_PREFERENCES = "user_preferences";
    public static final String USER_CHANNELS = "user_channels";
    public static final String YAHOO_LEAGUES = "yahoo_leagues";
    public static final String YAHOO_STANDINGS = "yahoo_standings";
    public static final String YAHOO_MATCHUPS = "yahoo_matchups";
    public static final String YAHOO_ROSTERS = "yahoo_rosters";

    private CdcTables() {
    }
}
