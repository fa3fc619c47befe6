package com.myscrollr.delivery.config;

import com.myscrollr.delivery.repository.LinkedAccountRepository;
import com.myscrollr.delivery.repository.LinkedLeagueRepository;
import com.myscrollr.delivery.routing.CdcTables;
import com.myscrollr.delivery.routing.DerivedKeyStrategy;
import com.myscrollr.delivery.routing.DirectKeyStrategy;
import com.myscrollr.delivery.routing.KeyDeriver;
import com.myscrollr.delivery.routing.PrecomputedSetStrategy;
import com.myscrollr.delivery.routing.RecordOwnerStrategy;
import com.myscrollr.delivery.routing.RoutingTable;
import com.myscrollr.delivery.store.SubscriberSetKeys;
import com.myscrollr.delivery.store.SubscriberSetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RoutingTableConfig {

    private static final Logger logger = LoggerFactory.getLogger(RoutingTableConfig.class);
    private static final String OWNER_FIELD = "logto_sub";
    private static final String TEAM_KEY_SEPARATOR = ".t.";

    @Bean
    public RoutingTable routingTable(SubscriberSetStore store,
                                     LinkedAccountRepository accountRepository,
                                     LinkedLeagueRepository leagueRepository,
                                     RoutingProperties properties) {
        RoutingTable table = RoutingTable.builder()
                .route(CdcTables.TRADES,
                        PrecomputedSetStrategy.fixedKey(store, SubscriberSetKeys.STREAM_NAMESPACE, "finance"))
                .route(CdcTables.GAMES,
                        PrecomputedSetStrategy.fixedKey(store, SubscriberSetKeys.STREAM_NAMESPACE, "sports"))
                .route(CdcTables.RSS_ITEMS,
                        PrecomputedSetStrategy.fromField(store, SubscriberSetKeys.RSS_NAMESPACE, "feed_url"))
                .route(CdcTables.USER_PREFERENCES, new RecordOwnerStrategy(OWNER_FIELD))
                .route(CdcTables.USER_CHANNELS, new RecordOwnerStrategy(OWNER_FIELD))
                .route(CdcTables.YAHOO_LEAGUES,
                        new DirectKeyStrategy("guid", accountRepository::findOwnerByGuid))
                .route(CdcTables.YAHOO_STANDINGS,
                        new DirectKeyStrategy("league_key", leagueRepository::findOwnerByLeagueKey))
                .route(CdcTables.YAHOO_MATCHUPS, new DerivedKeyStrategy("team_key",
                        KeyDeriver.prefixBefore(TEAM_KEY_SEPARATOR), leagueRepository::findOwnerByLeagueKey))
                .route(CdcTables.YAHOO_ROSTERS, new DerivedKeyStrategy("team_key",
                        KeyDeriver.prefixBefore(TEAM_KEY_SEPARATOR), leagueRepository::findOwnerByLeagueKey))
                .build();

        table.validateAgainst(properties.knownTables());
        logger.info("Routing table validated for {} tables: {}", table.tables().size(), table.tables());
        return table;
    }
}
