package io.cronagent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronagent.ActionRuntime;
import io.cronagent.CronService;
import io.cronagent.core.ActionResult;
import io.cronagent.internal.DefaultCronService;
import io.cronagent.internal.mongo.MongoJobRepository;
import io.cronagent.store.InMemoryJobRepository;
import io.cronagent.store.JobRepository;
import io.cronagent.store.JobStore;
import io.cronagent.store.JsonFileJobRepository;
import io.cronagent.web.CronExceptionHandler;
import io.cronagent.web.CronJobController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for the cron scheduler.
 *
 * <p>The job store backend is chosen by {@code cron.store.type}: {@code file} (default),
 * {@code memory} or {@code mongo}. A {@link JobRepository} or {@link ActionRuntime} bean defined by
 * the application takes precedence.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration"
})
@ConditionalOnClass(CronService.class)
@EnableConfigurationProperties(CronProperties.class)
@ConditionalOnProperty(prefix = "cron", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CronAutoConfiguration.class);

    static final String NO_RUNTIME_ERROR = "no action runtime configured";

    @Bean
    @ConditionalOnMissingBean
    public Clock cronClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(JobRepository.class)
    @ConditionalOnProperty(prefix = "cron.store", name = "type", havingValue = "file", matchIfMissing = true)
    public JsonFileJobRepository cronFileJobRepository(CronProperties props) {
        Path file = Path.of(props.getStore().getPath());
        log.info("cron store file path={}", file.toAbsolutePath());
        return new JsonFileJobRepository(file);
    }

    @Bean
    @ConditionalOnMissingBean(JobRepository.class)
    @ConditionalOnProperty(prefix = "cron.store", name = "type", havingValue = "memory")
    public InMemoryJobRepository cronInMemoryJobRepository() {
        return new InMemoryJobRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore cronJobStore(JobRepository repository, Clock clock) {
        return new JobStore(repository, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionRuntime cronActionRuntime() {
        return payload -> {
            log.warn("cron job fired without an ActionRuntime bean kind={}", payload.kind());
            return ActionResult.failure(NO_RUNTIME_ERROR);
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public CronService cronService(CronProperties props, JobStore jobStore, ActionRuntime runtime, Clock clock) {
        return new DefaultCronService(jobStore, runtime, props.toSettings(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CronLifecycle cronLifecycle(CronService cronService) {
        return new CronLifecycle(cronService);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "cron.store", name = "type", havingValue = "mongo")
    static class MongoStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(JobRepository.class)
        public MongoJobRepository cronMongoJobRepository(MongoTemplate mongoTemplate,
                                                         ObjectProvider<ObjectMapper> objectMapper) {
            return new MongoJobRepository(mongoTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean
        public CronMongoIndexConfig cronMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new CronMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "cron", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton cronIndexesInitializer(CronMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(RestController.class)
    @ConditionalOnProperty(prefix = "cron.web", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public CronJobController cronJobController(CronService cronService) {
            return new CronJobController(cronService);
        }

        @Bean
        @ConditionalOnMissingBean
        public CronExceptionHandler cronExceptionHandler() {
            return new CronExceptionHandler();
        }
    }
}
