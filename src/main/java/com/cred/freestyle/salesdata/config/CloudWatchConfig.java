package com.cred.freestyle.salesdata.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.util.Map;

/**
 * Metrics registry selection.
 *
 * With cloud.aws.cloudwatch.enabled=true the generator's counters and timers are pushed to
 * CloudWatch under the configured namespace. Otherwise they stay in memory, which is what local
 * runs and tests use; actuator's /actuator/metrics reads from either.
 *
 * @author Sales Data Team
 */
@Configuration
public class CloudWatchConfig {

    private static final Logger logger = LoggerFactory.getLogger(CloudWatchConfig.class);

    @Value("${cloud.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:SalesDataGenerator}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private Integer batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private String step;

    @Bean
    @ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true")
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * CloudWatch-backed registry. Settings are handed to Micrometer as its own
     * "cloudwatch.*" keys, so its defaults apply to anything not set here.
     *
     * @param cloudWatchAsyncClient CloudWatch client
     * @return MeterRegistry
     */
    @Bean
    @ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true")
    public MeterRegistry cloudWatchMeterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        Map<String, String> settings = Map.of(
                "cloudwatch.namespace", namespace,
                "cloudwatch.batchSize", String.valueOf(batchSize),
                "cloudwatch.step", step
        );
        io.micrometer.cloudwatch2.CloudWatchConfig registryConfig = settings::get;

        logger.info("Publishing generator metrics to CloudWatch namespace {} in {} every {}",
                namespace, awsRegion, step);
        return new CloudWatchMeterRegistry(registryConfig, Clock.SYSTEM, cloudWatchAsyncClient);
    }

    @Bean
    @ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "false", matchIfMissing = true)
    public MeterRegistry simpleMeterRegistry() {
        logger.info("CloudWatch publishing disabled, keeping generator metrics in memory");
        return new SimpleMeterRegistry();
    }
}
