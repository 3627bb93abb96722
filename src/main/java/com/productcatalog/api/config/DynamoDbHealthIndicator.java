package com.productcatalog.api.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Health indicator for DynamoDB connectivity and catalog table status.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;
    private final CatalogProperties catalogProperties;

    @Value("${aws.region:us-east-1}")
    private String region;

    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient, CatalogProperties catalogProperties) {
        this.dynamoDbClient = dynamoDbClient;
        this.catalogProperties = catalogProperties;
    }

    @Override
    public Health health() {
        String tableName = catalogProperties.getTableName();
        try {
            DescribeTableResponse response = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(tableName).build()
            );

            TableStatus status = response.table().tableStatus();

            if (status == TableStatus.ACTIVE) {
                return Health.up()
                    .withDetail("table", tableName)
                    .withDetail("status", "ACTIVE")
                    .withDetail("gsiCount", response.table().globalSecondaryIndexes().size())
                    .withDetail("region", String.valueOf(region))
                    .build();
            } else {
                return Health.down()
                    .withDetail("table", tableName)
                    .withDetail("status", String.valueOf(status))
                    .build();
            }

        } catch (SdkException e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", String.valueOf(e.getMessage()))
                .build();
        }
    }
}
