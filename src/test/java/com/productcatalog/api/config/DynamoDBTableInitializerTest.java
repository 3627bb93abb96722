package com.productcatalog.api.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DynamoDBTableInitializerTest {

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private DynamoDbWaiter waiter;

    private DynamoDBTableInitializer initializer;

    @BeforeEach
    void setUp() {
        CatalogProperties properties = new CatalogProperties();
        properties.setTableName("products_catalog_test");
        initializer = new DynamoDBTableInitializer(dynamoDbClient, properties);
    }

    @Test
    void run_TableExists_DoesNotCreate() {
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
            .thenReturn(DescribeTableResponse.builder().build());

        initializer.run(null);

        verify(dynamoDbClient, never()).createTable(any(CreateTableRequest.class));
    }

    @Test
    void run_TableMissing_CreatesAndWaits() {
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
            .thenThrow(ResourceNotFoundException.builder().message("not found").build());
        when(dynamoDbClient.waiter()).thenReturn(waiter);

        initializer.run(null);

        verify(dynamoDbClient).createTable(DynamoDBTableInitializer.buildCreateTableRequest("products_catalog_test"));
        verify(waiter).waitUntilTableExists(any(DescribeTableRequest.class));
    }

    @Test
    void run_OtherServiceError_Propagates() {
        when(dynamoDbClient.describeTable(any(DescribeTableRequest.class)))
            .thenThrow(DynamoDbException.builder().message("access denied").build());

        assertThatThrownBy(() -> initializer.run(null)).isInstanceOf(DynamoDbException.class);
    }

    @Test
    void buildCreateTableRequest_DefinesKeysAndThreeIndexes() {
        CreateTableRequest request = DynamoDBTableInitializer.buildCreateTableRequest("products_catalog");

        assertThat(request.billingMode()).isEqualTo(BillingMode.PAY_PER_REQUEST);
        assertThat(request.keySchema()).extracting(KeySchemaElement::attributeName).containsExactly("PK", "SK");
        assertThat(request.attributeDefinitions()).extracting(AttributeDefinition::attributeName)
            .containsExactlyInAnyOrder("PK", "SK", "brand_id", "product_id", "GSI3PK", "GSI3SK");
        assertThat(request.globalSecondaryIndexes()).extracting(GlobalSecondaryIndex::indexName)
            .containsExactly("GSI-1", "GSI-2", "GSI-3");

        GlobalSecondaryIndex inverted = request.globalSecondaryIndexes().get(0);
        assertThat(inverted.keySchema()).extracting(KeySchemaElement::attributeName).containsExactly("SK", "PK");
        assertThat(inverted.projection().projectionType()).isEqualTo(ProjectionType.ALL);
    }
}
