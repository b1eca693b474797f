package com.bbthechange.retroboard.repository.impl;

import com.bbthechange.retroboard.exception.RepositoryException;
import com.bbthechange.retroboard.exception.VersionConflictException;
import com.bbthechange.retroboard.model.Board;
import com.bbthechange.retroboard.model.BoardState;
import com.bbthechange.retroboard.repository.BoardRepository;
import com.bbthechange.retroboard.util.InstantAsLongAttributeConverter;
import com.bbthechange.retroboard.util.QueryPerformanceTracker;
import com.bbthechange.retroboard.util.RetroKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.Map;
import java.util.Optional;

@Repository
public class BoardRepositoryImpl implements BoardRepository {

    private static final Logger logger = LoggerFactory.getLogger(BoardRepositoryImpl.class);
    private static final String TABLE_NAME = CardRepositoryImpl.TABLE_NAME;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Board> boardSchema;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public BoardRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.boardSchema = TableSchema.fromBean(Board.class);
    }

    @Override
    public Board save(Board board) {
        return queryTracker.trackQuery("SaveBoard", TABLE_NAME, () -> {
            try {
                board.touch();
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(boardSchema.itemToMap(board, true))
                    .build());
                logger.debug("Saved board {}", board.getBoardId());
                return board;

            } catch (DynamoDbException e) {
                logger.error("Failed to save board {}", board.getBoardId(), e);
                throw new RepositoryException("Failed to save board", e);
            }
        });
    }

    @Override
    public Optional<Board> findById(String boardId) {
        return queryTracker.trackQuery("FindBoardById", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(boardKey(boardId))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.<Board>empty();
                }
                return Optional.of(boardSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find board {}", boardId, e);
                throw new RepositoryException("Failed to retrieve board", e);
            }
        });
    }

    @Override
    public void addAdmin(String boardId, String newAdminHash, String requesterHash) {
        queryTracker.trackQuery("AddBoardAdmin", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(boardKey(boardId))
                    .updateExpression("SET admins = list_append(admins, :candidateList), updatedAt = :now")
                    .conditionExpression("#state = :active AND contains(admins, :requester) AND NOT contains(admins, :candidate)")
                    .expressionAttributeNames(Map.of("#state", "state"))
                    .expressionAttributeValues(Map.of(
                        ":candidateList", AttributeValue.builder().l(AttributeValue.builder().s(newAdminHash).build()).build(),
                        ":candidate", AttributeValue.builder().s(newAdminHash).build(),
                        ":requester", AttributeValue.builder().s(requesterHash).build(),
                        ":active", AttributeValue.builder().s(BoardState.ACTIVE.name()).build(),
                        ":now", InstantAsLongAttributeConverter.now()))
                    .build());
                logger.debug("Added admin to board {}", boardId);
                return null;

            } catch (ConditionalCheckFailedException e) {
                throw new VersionConflictException("Board changed while adding an admin: " + boardId, e);
            } catch (DynamoDbException e) {
                logger.error("Failed to add admin to board {}", boardId, e);
                throw new RepositoryException("Failed to add board admin", e);
            }
        });
    }

    private static Map<String, AttributeValue> boardKey(String boardId) {
        return Map.of(
            "pk", AttributeValue.builder().s(RetroKeyFactory.getBoardPk(boardId)).build(),
            "sk", AttributeValue.builder().s(RetroKeyFactory.getMetadataSk()).build());
    }
}
