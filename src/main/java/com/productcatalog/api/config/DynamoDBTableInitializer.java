package com.productcatalog.api.config;

import com.productcatalog.api.util.CatalogKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.List;

/**
 * Creates the catalog table and its three secondary indexes when it does not exist yet.
 * Meant for DynamoDB Local and LocalStack; production tables are provisioned outside the app.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true")
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbClient dynamoDbClient;
    private final CatalogProperties catalogProperties;

    @Autowired
    public DynamoDBTableInitializer(DynamoDbClient dynamoDbClient, CatalogProperties catalogProperties) {
        this.dynamoDbClient = dynamoDbClient;
        this.catalogProperties = catalogProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(catalogProperties.getTableName());
    }

    void createTableIfNotExists(String tableName) {
        try {
            dynamoDbClient.describeTable(DescribeTableRequest.builder().tableName(tableName).build());
            logger.info("Table {} already exists", tableName);

        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            dynamoDbClient.createTable(buildCreateTableRequest(tableName));
            dynamoDbClient.waiter().waitUntilTableExists(DescribeTableRequest.builder().tableName(tableName).build());
            logger.info("Table {} created successfully with GSIs", tableName);
        } catch (DynamoDbException e) {
            logger.error("Error creating table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }

    static CreateTableRequest buildCreateTableRequest(String tableName) {
        return CreateTableRequest.builder()
            .tableName(tableName)
            .billingMode(BillingMode.PAY_PER_REQUEST)
            .attributeDefinitions(
                stringAttribute(CatalogKeyFactory.PK_FIELD),
                stringAttribute(CatalogKeyFactory.SK_FIELD),
                stringAttribute(CatalogKeyFactory.GSI2_PK),
                stringAttribute(CatalogKeyFactory.GSI2_SK),
                stringAttribute(CatalogKeyFactory.GSI3_PK),
                stringAttribute(CatalogKeyFactory.GSI3_SK))
            .keySchema(keySchema(CatalogKeyFactory.PK_FIELD, CatalogKeyFactory.SK_FIELD))
            .globalSecondaryIndexes(
                createGSI(CatalogKeyFactory.GSI1_NAME, CatalogKeyFactory.GSI1_PK, CatalogKeyFactory.GSI1_SK),
                createGSI(CatalogKeyFactory.GSI2_NAME, CatalogKeyFactory.GSI2_PK, CatalogKeyFactory.GSI2_SK),
                createGSI(CatalogKeyFactory.GSI3_NAME, CatalogKeyFactory.GSI3_PK, CatalogKeyFactory.GSI3_SK))
            .build();
    }

    private static GlobalSecondaryIndex createGSI(String indexName, String pkField, String skField) {
        return GlobalSecondaryIndex.builder()
            .indexName(indexName)
            .keySchema(keySchema(pkField, skField))
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static List<KeySchemaElement> keySchema(String hashKey, String rangeKey) {
        return List.of(
            KeySchemaElement.builder().attributeName(hashKey).keyType(KeyType.HASH).build(),
            KeySchemaElement.builder().attributeName(rangeKey).keyType(KeyType.RANGE).build());
    }

    private static AttributeDefinition stringAttribute(String name) {
        return AttributeDefinition.builder()
            .attributeName(name)
            .attributeType(ScalarAttributeType.S)
            .build();
    }
}
