package io.periodic4j.config;

import io.periodic4j.OwnerResolver;
import io.periodic4j.ScheduleCatalog;
import io.periodic4j.ScheduleOwnership;
import io.periodic4j.core.OwnerRegistry;
import io.periodic4j.core.RecurrenceResolver;
import io.periodic4j.internal.DefaultScheduleCatalog;
import io.periodic4j.internal.DefaultScheduleOwnership;
import io.periodic4j.internal.mongo.DateChangedCallback;
import io.periodic4j.internal.mongo.MongoScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for periodic4j components.
 */
@AutoConfiguration
@ConditionalOnClass({ScheduleOwnership.class, MongoTemplate.class})
@EnableConfigurationProperties(PeriodicProperties.class)
@ConditionalOnProperty(prefix = "periodic", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PeriodicConfig {

    private static final Logger log = LoggerFactory.getLogger(PeriodicConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock periodicClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public DateChangedCallback dateChangedCallback(Clock clock) {
        return new DateChangedCallback(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoScheduleStore mongoScheduleStore(MongoTemplate mongoTemplate,
                                                    PeriodicProperties props,
                                                    ObjectProvider<MongoTransactionManager> transactionManager) {
        TransactionOperations transactions = TransactionOperations.withoutTransaction();
        MongoTransactionManager tm = transactionManager.getIfAvailable();
        if (props.isTransactional() && tm != null) {
            transactions = new TransactionTemplate(tm);
        } else if (props.isTransactional()) {
            log.info("No MongoTransactionManager bean found; schedule writes run without transactions");
        }
        return new MongoScheduleStore(mongoTemplate, transactions);
    }

    @Bean
    @ConditionalOnMissingBean
    protected PeriodicMongoIndexConfig periodicMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new PeriodicMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public OwnerRegistry ownerRegistry(ObjectProvider<List<OwnerResolver<?>>> resolversProvider) {
        List<OwnerResolver<?>> resolvers = resolversProvider.getIfAvailable(List::of);
        return new OwnerRegistry(resolvers);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecurrenceResolver recurrenceResolver(MongoScheduleStore store) {
        return new RecurrenceResolver(store);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleOwnership scheduleOwnership(PeriodicProperties props, MongoScheduleStore store) {
        return new DefaultScheduleOwnership(store, props.getDetachPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleCatalog scheduleCatalog(MongoScheduleStore store, OwnerRegistry registry, RecurrenceResolver resolver) {
        return new DefaultScheduleCatalog(store, registry, resolver);
    }

    @Bean
    @ConditionalOnProperty(prefix = "periodic", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton periodicIndexesInitializer(PeriodicMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
