package com.bbthechange.retroboard.config;

import com.bbthechange.retroboard.model.FeedbackCard;
import com.bbthechange.retroboard.util.RetroKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the single RetroBoardTable with its board and board/user indexes on startup.
 * The key schema comes from the annotated {@link com.bbthechange.retroboard.model.BaseItem}
 * getters, so any concrete item class describes it.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    @Autowired
    private DynamoDbEnhancedClient dynamoDbEnhancedClient;

    private static final String TABLE_NAME = "RetroBoardTable";

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists();
    }

    void createTableIfNotExists() {
        DynamoDbTable<FeedbackCard> table = dynamoDbEnhancedClient.table(TABLE_NAME, TableSchema.fromBean(FeedbackCard.class));
        try {
            table.describeTable();
            logger.info("Table {} already exists", TABLE_NAME);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", TABLE_NAME);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput())
                .globalSecondaryIndices(
                    createGSI(RetroKeyFactory.BOARD_INDEX),
                    createGSI(RetroKeyFactory.BOARD_USER_INDEX))
                .build());
            logger.info("Table {} created successfully with GSIs", TABLE_NAME);
        } catch (RuntimeException e) {
            logger.error("Error creating table {}: {}", TABLE_NAME, e.getMessage());
            throw e;
        }
    }

    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }
}
