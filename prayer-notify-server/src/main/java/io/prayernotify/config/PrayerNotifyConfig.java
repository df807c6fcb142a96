package io.prayernotify.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.prayernotify.JobHandler;
import io.prayernotify.TaskQueue;
import io.prayernotify.core.JobHandlerRegistry;
import io.prayernotify.internal.mongo.MongoJobStore;
import io.prayernotify.internal.mongo.MongoTaskQueue;
import io.prayernotify.jobs.DailySweepJobHandler;
import io.prayernotify.jobs.HttpTargetJobHandler;
import io.prayernotify.prayer.DedupKeyDeriver;
import io.prayernotify.prayer.FireTimeResolver;
import io.prayernotify.prayer.NotificationTaskScheduler;
import io.prayernotify.prayer.NotificationTextFormatter;
import io.prayernotify.prayer.SweepOrchestrator;
import io.prayernotify.prayer.store.DeviceRegistry;
import io.prayernotify.prayer.store.PreferenceStore;
import io.prayernotify.prayer.store.ScheduleStore;
import io.prayernotify.prayer.store.SubscriptionStore;
import io.prayernotify.prayer.store.SweepStores;
import io.prayernotify.prayer.store.VenueDirectory;
import io.prayernotify.store.mongo.MongoDeviceRegistry;
import io.prayernotify.store.mongo.MongoPreferenceStore;
import io.prayernotify.store.mongo.MongoScheduleStore;
import io.prayernotify.store.mongo.MongoSubscriptionStore;
import io.prayernotify.store.mongo.MongoVenueDirectory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration for the task queue, the Mongo stores and the sweep pipeline.
 */
@AutoConfiguration
@ConditionalOnClass({TaskQueue.class, MongoTemplate.class})
@EnableConfigurationProperties({PrayerNotifyProperties.class, QueueProperties.class})
@ConditionalOnProperty(prefix = "prayer.queue", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PrayerNotifyConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock prayerClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        return new MongoJobStore(mongoTemplate, objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoIndexConfig mongoIndexConfig(MongoTemplate mongoTemplate) {
        return new MongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler<?>>> handlersProvider) {
        List<JobHandler<?>> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskQueue taskQueue(QueueProperties props,
                               MongoJobStore jobStore,
                               JobHandlerRegistry registry,
                               ObjectMapper om,
                               Clock clock) {
        return new MongoTaskQueue(props, jobStore, registry, om, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueLifecycle queueLifecycle(TaskQueue queue, PrayerNotifyProperties props) {
        return new QueueLifecycle(queue, props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "prayer.queue", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton prayerIndexesInitializer(MongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    @Bean
    @ConditionalOnMissingBean
    public VenueDirectory venueDirectory(MongoTemplate mongoTemplate) {
        return new MongoVenueDirectory(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleStore scheduleStore(MongoTemplate mongoTemplate) {
        return new MongoScheduleStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public PreferenceStore preferenceStore(MongoTemplate mongoTemplate) {
        return new MongoPreferenceStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeviceRegistry deviceRegistry(MongoTemplate mongoTemplate) {
        return new MongoDeviceRegistry(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionStore subscriptionStore(MongoTemplate mongoTemplate) {
        return new MongoSubscriptionStore(mongoTemplate);
    }

    @Bean
    public SweepStores sweepStores(VenueDirectory venues,
                                   ScheduleStore schedules,
                                   PreferenceStore preferences,
                                   DeviceRegistry devices,
                                   SubscriptionStore subscriptions) {
        return new SweepStores(venues, schedules, preferences, devices, subscriptions);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationTaskScheduler notificationTaskScheduler(TaskQueue queue, ObjectMapper om, PrayerNotifyProperties props) {
        return new NotificationTaskScheduler(queue, om, props.getDispatchUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public SweepOrchestrator sweepOrchestrator(SweepStores stores,
                                               NotificationTaskScheduler scheduler,
                                               PrayerNotifyProperties props,
                                               Clock clock) {
        return new SweepOrchestrator(
                stores,
                new FireTimeResolver(),
                new DedupKeyDeriver(),
                new NotificationTextFormatter(props.zoneId(), props.getDefaultVenueName()),
                scheduler,
                clock,
                props.zoneId()
        );
    }

    @Bean
    public DailySweepJobHandler dailySweepJobHandler(ObjectProvider<SweepOrchestrator> orchestrator) {
        return new DailySweepJobHandler(orchestrator);
    }

    @Bean
    public HttpTargetJobHandler httpTargetJobHandler(ObjectProvider<RestClient.Builder> builder) {
        return new HttpTargetJobHandler(builder.getIfAvailable(RestClient::builder).build());
    }
}
