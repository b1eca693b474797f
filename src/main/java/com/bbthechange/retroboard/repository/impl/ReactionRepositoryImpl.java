package com.bbthechange.retroboard.repository.impl;

import com.bbthechange.retroboard.exception.RepositoryException;
import com.bbthechange.retroboard.exception.VersionConflictException;
import com.bbthechange.retroboard.model.Reaction;
import com.bbthechange.retroboard.repository.CounterDelta;
import com.bbthechange.retroboard.repository.ReactionRepository;
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

import java.util.*;

import static com.bbthechange.retroboard.repository.impl.CardRepositoryImpl.cardKey;
import static com.bbthechange.retroboard.repository.impl.CardRepositoryImpl.num;
import static com.bbthechange.retroboard.repository.impl.CardRepositoryImpl.str;

/**
 * DynamoDB implementation of ReactionRepository.
 * Reactions live in the card's partition; inserts and deletes move the card counters
 * in the same transaction.
 */
@Repository
public class ReactionRepositoryImpl implements ReactionRepository {

    private static final Logger logger = LoggerFactory.getLogger(ReactionRepositoryImpl.class);
    private static final String TABLE_NAME = CardRepositoryImpl.TABLE_NAME;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Reaction> reactionSchema;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public ReactionRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.reactionSchema = TableSchema.fromBean(Reaction.class);
    }

    @Override
    public Optional<Reaction> findByCardAndUser(String cardId, String userHash) {
        return queryTracker.trackQuery("FindReaction", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(reactionKey(cardId, userHash))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.<Reaction>empty();
                }
                return Optional.of(reactionSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find reaction on card {}", cardId, e);
                throw new RepositoryException("Failed to retrieve reaction", e);
            }
        });
    }

    @Override
    public List<Reaction> findByCardId(String cardId) {
        return queryTracker.trackQuery("FindReactionsByCard", TABLE_NAME, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .keyConditionExpression("pk = :pk AND begins_with(sk, :prefix)")
                    .expressionAttributeValues(Map.of(
                        ":pk", str(RetroKeyFactory.getCardPk(cardId)),
                        ":prefix", str(RetroKeyFactory.getReactionPrefix())))
                    .consistentRead(true)
                    .build();

                List<Reaction> reactions = new ArrayList<>();
                Map<String, AttributeValue> startKey = null;
                do {
                    QueryRequest page = startKey == null ? request : request.toBuilder().exclusiveStartKey(startKey).build();
                    QueryResponse response = dynamoDbClient.query(page);
                    response.items().forEach(item -> reactions.add(reactionSchema.mapToItem(item)));
                    startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey() : null;
                } while (startKey != null);
                return reactions;

            } catch (DynamoDbException e) {
                logger.error("Failed to list reactions for card {}", cardId, e);
                throw new RepositoryException("Failed to retrieve reactions", e);
            }
        });
    }

    @Override
    public long countByBoardAndUser(String boardId, String userHash) {
        return queryTracker.trackQuery("CountUserReactions", TABLE_NAME, () -> {
            try {
                QueryRequest request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(RetroKeyFactory.BOARD_USER_INDEX)
                    .keyConditionExpression("gsi2pk = :pk AND begins_with(gsi2sk, :prefix)")
                    .expressionAttributeValues(Map.of(
                        ":pk", str(RetroKeyFactory.getBoardUserPk(boardId, userHash)),
                        ":prefix", str(RetroKeyFactory.getReactionPrefix())))
                    .select(Select.COUNT)
                    .build();

                return CardRepositoryImpl.countAll(dynamoDbClient, request);

            } catch (DynamoDbException e) {
                logger.error("Failed to count reactions on board {}", boardId, e);
                throw new RepositoryException("Failed to count reactions", e);
            }
        });
    }

    @Override
    public void insert(Reaction reaction, List<CounterDelta> deltas) {
        List<TransactWriteItem> items = new ArrayList<>();

        // Only one reaction per (card, user): a concurrent first vote loses here
        items.add(TransactWriteItem.builder()
            .put(Put.builder()
                .tableName(TABLE_NAME)
                .item(reactionSchema.itemToMap(reaction, true))
                .conditionExpression("attribute_not_exists(pk)")
                .build())
            .build());
        deltas.forEach(delta -> items.add(counterUpdate(delta)));

        executeTransaction("AddReaction", items, reaction);
    }

    @Override
    public Reaction update(Reaction reaction) {
        return queryTracker.trackQuery("UpdateReaction", TABLE_NAME, () -> {
            try {
                Map<String, AttributeValue> values = new HashMap<>();
                values.put(":type", str(reaction.getReactionType().name()));
                values.put(":now", InstantAsLongAttributeConverter.now());
                String expression = "SET reactionType = :type, updatedAt = :now";
                if (reaction.getUserAlias() != null) {
                    expression += ", userAlias = :alias";
                    values.put(":alias", str(reaction.getUserAlias()));
                }

                UpdateItemResponse response = dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(reactionKey(reaction.getCardId(), reaction.getUserHash()))
                    .updateExpression(expression)
                    .conditionExpression("attribute_exists(pk)")
                    .expressionAttributeValues(values)
                    .returnValues(ReturnValue.ALL_NEW)
                    .build());
                return reactionSchema.mapToItem(response.attributes());

            } catch (ConditionalCheckFailedException e) {
                throw new VersionConflictException("Reaction removed during update on card " + reaction.getCardId(), e);
            } catch (DynamoDbException e) {
                logger.error("Failed to update reaction on card {}", reaction.getCardId(), e);
                throw new RepositoryException("Failed to update reaction", e);
            }
        });
    }

    @Override
    public void delete(Reaction reaction, List<CounterDelta> deltas) {
        List<TransactWriteItem> items = new ArrayList<>();

        items.add(TransactWriteItem.builder()
            .delete(Delete.builder()
                .tableName(TABLE_NAME)
                .key(reactionKey(reaction.getCardId(), reaction.getUserHash()))
                .conditionExpression("attribute_exists(pk)")
                .build())
            .build());
        deltas.forEach(delta -> items.add(counterUpdate(delta)));

        executeTransaction("RemoveReaction", items, reaction);
    }

    /**
     * Build the atomic counter update for one card. Decrements are guarded so a count can
     * never go below zero.
     */
    TransactWriteItem counterUpdate(CounterDelta delta) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":aggregated", num(delta.aggregatedDelta()));
        values.put(":one", num(1));

        StringBuilder update = new StringBuilder(
            "SET aggregatedReactionCount = aggregatedReactionCount + :aggregated, #ver = #ver + :one");
        StringBuilder condition = new StringBuilder("attribute_exists(pk)");

        if (delta.directDelta() != 0) {
            update.append(", directReactionCount = directReactionCount + :direct");
            values.put(":direct", num(delta.directDelta()));
            if (delta.directDelta() < 0) {
                condition.append(" AND directReactionCount >= :minDirect");
                values.put(":minDirect", num(-delta.directDelta()));
            }
        }
        if (delta.guardParent()) {
            if (delta.expectedParentId() == null) {
                condition.append(" AND attribute_not_exists(parentCardId)");
            } else {
                condition.append(" AND parentCardId = :parent");
                values.put(":parent", str(delta.expectedParentId()));
            }
        }

        return TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(cardKey(delta.cardId()))
                .updateExpression(update.toString())
                .conditionExpression(condition.toString())
                .expressionAttributeNames(Map.of("#ver", "version"))
                .expressionAttributeValues(values)
                .build())
            .build();
    }

    private void executeTransaction(String operation, List<TransactWriteItem> items, Reaction reaction) {
        queryTracker.trackQuery(operation, TABLE_NAME, () -> {
            try {
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                    .transactItems(items)
                    .build());
                logger.debug("{} committed on card {}", operation, reaction.getCardId());
                return null;

            } catch (TransactionCanceledException e) {
                logger.debug("{} cancelled on card {}: {}", operation, reaction.getCardId(),
                    CardRepositoryImpl.cancellationCodes(e));
                throw new VersionConflictException(operation + " conflicted on card " + reaction.getCardId(), e);
            } catch (DynamoDbException e) {
                logger.error("{} failed on card {}", operation, reaction.getCardId(), e);
                throw new RepositoryException("Failed to execute " + operation, e);
            }
        });
    }

    private static Map<String, AttributeValue> reactionKey(String cardId, String userHash) {
        return Map.of(
            "pk", str(RetroKeyFactory.getCardPk(cardId)),
            "sk", str(RetroKeyFactory.getReactionSk(userHash)));
    }
}
