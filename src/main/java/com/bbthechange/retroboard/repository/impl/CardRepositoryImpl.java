package com.bbthechange.retroboard.repository.impl;

import com.bbthechange.retroboard.exception.RepositoryException;
import com.bbthechange.retroboard.exception.VersionConflictException;
import com.bbthechange.retroboard.model.ActionCard;
import com.bbthechange.retroboard.model.Card;
import com.bbthechange.retroboard.model.CardKind;
import com.bbthechange.retroboard.model.FeedbackCard;
import com.bbthechange.retroboard.model.Reaction;
import com.bbthechange.retroboard.repository.CardDeletion;
import com.bbthechange.retroboard.repository.CardRepository;
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

/**
 * DynamoDB implementation of CardRepository.
 *
 * Counter changes are expressed as "x = x + :delta" update expressions and every relationship
 * change is a single TransactWriteItems call whose condition expressions pin the state the
 * caller validated against.
 */
@Repository
public class CardRepositoryImpl implements CardRepository {

    private static final Logger logger = LoggerFactory.getLogger(CardRepositoryImpl.class);
    static final String TABLE_NAME = "RetroBoardTable";
    static final int MAX_TRANSACTION_ITEMS = 100;
    private static final int MAX_BATCH_GET = 100;
    private static final int MAX_BATCH_WRITE = 25;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<FeedbackCard> feedbackSchema;
    private final TableSchema<ActionCard> actionSchema;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public CardRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.feedbackSchema = TableSchema.fromBean(FeedbackCard.class);
        this.actionSchema = TableSchema.fromBean(ActionCard.class);
    }

    @Override
    public Card save(Card card) {
        return queryTracker.trackQuery("SaveCard", TABLE_NAME, () -> {
            try {
                PutItemRequest request = PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(toItem(card))
                    .conditionExpression("attribute_not_exists(pk)")
                    .build();

                dynamoDbClient.putItem(request);
                logger.debug("Saved {} card {} on board {}", card.getCardType(), card.getCardId(), card.getBoardId());
                return card;

            } catch (ConditionalCheckFailedException e) {
                throw new VersionConflictException("Card already exists: " + card.getCardId(), e);
            } catch (DynamoDbException e) {
                logger.error("Failed to save card {}", card.getCardId(), e);
                throw new RepositoryException("Failed to save card", e);
            }
        });
    }

    @Override
    public Optional<Card> findById(String cardId) {
        return queryTracker.trackQuery("FindCardById", TABLE_NAME, () -> {
            try {
                GetItemRequest request = GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(cardKey(cardId))
                    .consistentRead(true)
                    .build();

                GetItemResponse response = dynamoDbClient.getItem(request);
                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.<Card>empty();
                }
                return Optional.of(toCard(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find card {}", cardId, e);
                throw new RepositoryException("Failed to retrieve card", e);
            }
        });
    }

    @Override
    public List<Card> findByIds(Collection<String> cardIds) {
        if (cardIds == null || cardIds.isEmpty()) {
            return Collections.emptyList();
        }

        return queryTracker.trackQuery("BatchGetCards", TABLE_NAME, () -> {
            try {
                List<Card> cards = new ArrayList<>();
                List<String> ids = new ArrayList<>(new LinkedHashSet<>(cardIds));

                for (int i = 0; i < ids.size(); i += MAX_BATCH_GET) {
                    List<Map<String, AttributeValue>> keys = new ArrayList<>();
                    for (String id : ids.subList(i, Math.min(i + MAX_BATCH_GET, ids.size()))) {
                        keys.add(cardKey(id));
                    }

                    Map<String, KeysAndAttributes> pending = Map.of(TABLE_NAME,
                        KeysAndAttributes.builder().keys(keys).consistentRead(true).build());

                    while (!pending.isEmpty()) {
                        BatchGetItemResponse response = dynamoDbClient.batchGetItem(
                            BatchGetItemRequest.builder().requestItems(pending).build());
                        response.responses().getOrDefault(TABLE_NAME, Collections.emptyList())
                            .forEach(item -> cards.add(toCard(item)));
                        pending = response.hasUnprocessedKeys() ? response.unprocessedKeys() : Collections.emptyMap();
                    }
                }
                return cards;

            } catch (DynamoDbException e) {
                logger.error("Failed to batch-get {} cards", cardIds.size(), e);
                throw new RepositoryException("Failed to retrieve cards", e);
            }
        });
    }

    @Override
    public List<Card> findByBoardId(String boardId) {
        return queryTracker.trackQuery("FindCardsByBoard", TABLE_NAME, () -> {
            try {
                Map<String, AttributeValue> values = new HashMap<>();
                values.put(":pk", str(RetroKeyFactory.getBoardPk(boardId)));
                values.put(":prefix", str(RetroKeyFactory.getCardPrefix()));

                return queryAll(QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(RetroKeyFactory.BOARD_INDEX)
                    .keyConditionExpression("gsi1pk = :pk AND begins_with(gsi1sk, :prefix)")
                    .expressionAttributeValues(values)
                    .build());

            } catch (DynamoDbException e) {
                logger.error("Failed to list cards for board {}", boardId, e);
                throw new RepositoryException("Failed to retrieve cards for board", e);
            }
        });
    }

    @Override
    public List<ActionCard> findActionCardsLinkedTo(String boardId, String feedbackCardId) {
        return queryTracker.trackQuery("FindLinkingActionCards", TABLE_NAME, () -> {
            try {
                Map<String, AttributeValue> values = new HashMap<>();
                values.put(":pk", str(RetroKeyFactory.getBoardPk(boardId)));
                values.put(":prefix", str(RetroKeyFactory.getCardPrefix()));
                values.put(":action", str(CardKind.ACTION.name()));
                values.put(":feedbackId", str(feedbackCardId));

                List<Card> cards = queryAll(QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(RetroKeyFactory.BOARD_INDEX)
                    .keyConditionExpression("gsi1pk = :pk AND begins_with(gsi1sk, :prefix)")
                    .filterExpression("cardType = :action AND contains(linkedFeedbackIds, :feedbackId)")
                    .expressionAttributeValues(values)
                    .build());

                List<ActionCard> actions = new ArrayList<>();
                for (Card card : cards) {
                    if (card instanceof ActionCard action) {
                        actions.add(action);
                    }
                }
                return actions;

            } catch (DynamoDbException e) {
                logger.error("Failed to find action cards linked to {}", feedbackCardId, e);
                throw new RepositoryException("Failed to retrieve linked action cards", e);
            }
        });
    }

    @Override
    public long countFeedbackCards(String boardId, String ownerHash) {
        return queryTracker.trackQuery("CountFeedbackCards", TABLE_NAME, () -> {
            try {
                Map<String, AttributeValue> values = new HashMap<>();
                values.put(":pk", str(RetroKeyFactory.getBoardUserPk(boardId, ownerHash)));
                values.put(":prefix", str(RetroKeyFactory.getCardPrefix()));
                values.put(":feedback", str(CardKind.FEEDBACK.name()));

                QueryRequest base = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(RetroKeyFactory.BOARD_USER_INDEX)
                    .keyConditionExpression("gsi2pk = :pk AND begins_with(gsi2sk, :prefix)")
                    .filterExpression("cardType = :feedback")
                    .expressionAttributeValues(values)
                    .select(Select.COUNT)
                    .build();

                return countAll(dynamoDbClient, base);

            } catch (DynamoDbException e) {
                logger.error("Failed to count feedback cards on board {}", boardId, e);
                throw new RepositoryException("Failed to count cards", e);
            }
        });
    }

    @Override
    public Optional<Card> updateContent(String cardId, String content) {
        return updateField("UpdateCardContent", cardId, "#content", "content", content);
    }

    @Override
    public Optional<Card> updateColumn(String cardId, String columnId) {
        return updateField("UpdateCardColumn", cardId, "#column", "columnId", columnId);
    }

    private Optional<Card> updateField(String operation, String cardId, String placeholder,
                                       String attribute, String value) {
        return queryTracker.trackQuery(operation, TABLE_NAME, () -> {
            try {
                UpdateItemRequest request = UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(cardKey(cardId))
                    .updateExpression("SET " + placeholder + " = :value, updatedAt = :now, #ver = #ver + :one")
                    .conditionExpression("attribute_exists(pk)")
                    .expressionAttributeNames(Map.of(placeholder, attribute, "#ver", "version"))
                    .expressionAttributeValues(Map.of(
                        ":value", str(value),
                        ":now", InstantAsLongAttributeConverter.now(),
                        ":one", num(1)))
                    .returnValues(ReturnValue.ALL_NEW)
                    .build();

                UpdateItemResponse response = dynamoDbClient.updateItem(request);
                return Optional.of(toCard(response.attributes()));

            } catch (ConditionalCheckFailedException e) {
                logger.debug("Card {} vanished before {}", cardId, operation);
                return Optional.<Card>empty();
            } catch (DynamoDbException e) {
                logger.error("Failed {} for card {}", operation, cardId, e);
                throw new RepositoryException("Failed to update card", e);
            }
        });
    }

    @Override
    public void attachChild(FeedbackCard parent, FeedbackCard child, FeedbackCard previousParent, int contribution) {
        List<TransactWriteItem> items = new ArrayList<>();

        // 1. Child points at its new parent; must still be at the version that was validated
        Map<String, AttributeValue> childValues = new HashMap<>();
        childValues.put(":parent", str(parent.getCardId()));
        childValues.put(":childVer", num(child.getVersion()));
        childValues.put(":now", InstantAsLongAttributeConverter.now());
        childValues.put(":one", num(1));
        String childCondition = "#ver = :childVer AND attribute_not_exists(childCardIds)";
        if (previousParent == null) {
            childCondition += " AND attribute_not_exists(parentCardId)";
        } else {
            childCondition += " AND parentCardId = :oldParent";
            childValues.put(":oldParent", str(previousParent.getCardId()));
        }
        items.add(TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(cardKey(child.getCardId()))
                .updateExpression("SET parentCardId = :parent, updatedAt = :now, #ver = #ver + :one")
                .conditionExpression(childCondition)
                .expressionAttributeNames(Map.of("#ver", "version"))
                .expressionAttributeValues(childValues)
                .build())
            .build());

        // 2. Parent gains the child and its votes; it must not have become a child itself
        items.add(TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(cardKey(parent.getCardId()))
                .updateExpression("ADD childCardIds :child SET aggregatedReactionCount = aggregatedReactionCount + :delta, #ver = #ver + :one")
                .conditionExpression("attribute_exists(pk) AND attribute_not_exists(parentCardId)")
                .expressionAttributeNames(Map.of("#ver", "version"))
                .expressionAttributeValues(Map.of(
                    ":child", strSet(child.getCardId()),
                    ":delta", num(contribution),
                    ":one", num(1)))
                .build())
            .build());

        // 3. Previous parent loses them
        if (previousParent != null) {
            items.add(removeChildFromParent(previousParent.getCardId(), child.getCardId(), contribution));
        }

        executeTransaction("AttachChildCard", items,
            "child " + child.getCardId() + " under " + parent.getCardId());
    }

    @Override
    public void detachChild(FeedbackCard parent, FeedbackCard child, int contribution) {
        List<TransactWriteItem> items = new ArrayList<>();

        items.add(TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(cardKey(child.getCardId()))
                .updateExpression("REMOVE parentCardId SET updatedAt = :now, #ver = #ver + :one")
                .conditionExpression("#ver = :childVer AND parentCardId = :parent")
                .expressionAttributeNames(Map.of("#ver", "version"))
                .expressionAttributeValues(Map.of(
                    ":childVer", num(child.getVersion()),
                    ":parent", str(parent.getCardId()),
                    ":now", InstantAsLongAttributeConverter.now(),
                    ":one", num(1)))
                .build())
            .build());

        items.add(removeChildFromParent(parent.getCardId(), child.getCardId(), contribution));

        executeTransaction("DetachChildCard", items,
            "child " + child.getCardId() + " from " + parent.getCardId());
    }

    private TransactWriteItem removeChildFromParent(String parentId, String childId, int contribution) {
        return TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(cardKey(parentId))
                .updateExpression("DELETE childCardIds :child SET aggregatedReactionCount = aggregatedReactionCount - :delta, #ver = #ver + :one")
                .conditionExpression("attribute_exists(pk) AND contains(childCardIds, :childId)")
                .expressionAttributeNames(Map.of("#ver", "version"))
                .expressionAttributeValues(Map.of(
                    ":child", strSet(childId),
                    ":childId", str(childId),
                    ":delta", num(contribution),
                    ":one", num(1)))
                .build())
            .build();
    }

    @Override
    public void addLinkedFeedback(ActionCard action, FeedbackCard feedback) {
        List<TransactWriteItem> items = new ArrayList<>();

        items.add(TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(cardKey(action.getCardId()))
                .updateExpression("ADD linkedFeedbackIds :feedback SET updatedAt = :now, #ver = #ver + :one")
                .conditionExpression("attribute_exists(pk)")
                .expressionAttributeNames(Map.of("#ver", "version"))
                .expressionAttributeValues(Map.of(
                    ":feedback", strSet(feedback.getCardId()),
                    ":now", InstantAsLongAttributeConverter.now(),
                    ":one", num(1)))
                .build())
            .build());

        // Bumping the feedback version makes a delete planned before this link fail and re-read
        items.add(TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(cardKey(feedback.getCardId()))
                .updateExpression("SET #ver = #ver + :one")
                .conditionExpression("attribute_exists(pk) AND cardType = :feedbackType AND #ver = :ver")
                .expressionAttributeNames(Map.of("#ver", "version"))
                .expressionAttributeValues(Map.of(
                    ":feedbackType", str(CardKind.FEEDBACK.name()),
                    ":ver", num(feedback.getVersion()),
                    ":one", num(1)))
                .build())
            .build());

        executeTransaction("LinkActionCard", items,
            "action " + action.getCardId() + " to " + feedback.getCardId());
    }

    @Override
    public void removeLinkedFeedback(ActionCard action, String feedbackCardId) {
        queryTracker.trackQuery("UnlinkActionCard", TABLE_NAME, () -> {
            try {
                UpdateItemRequest request = UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(cardKey(action.getCardId()))
                    .updateExpression("DELETE linkedFeedbackIds :feedback SET updatedAt = :now, #ver = #ver + :one")
                    .conditionExpression("attribute_exists(pk)")
                    .expressionAttributeNames(Map.of("#ver", "version"))
                    .expressionAttributeValues(Map.of(
                        ":feedback", strSet(feedbackCardId),
                        ":now", InstantAsLongAttributeConverter.now(),
                        ":one", num(1)))
                    .build();

                dynamoDbClient.updateItem(request);
                return null;

            } catch (ConditionalCheckFailedException e) {
                throw new VersionConflictException("Action card changed during unlink: " + action.getCardId(), e);
            } catch (DynamoDbException e) {
                logger.error("Failed to unlink action card {} from {}", action.getCardId(), feedbackCardId, e);
                throw new RepositoryException("Failed to unlink cards", e);
            }
        });
    }

    @Override
    public void delete(CardDeletion deletion) {
        Card card = deletion.card();
        String cardId = card.getCardId();
        List<TransactWriteItem> structural = new ArrayList<>();

        // 1. The card itself, at the version the plan was built from
        structural.add(TransactWriteItem.builder()
            .delete(Delete.builder()
                .tableName(TABLE_NAME)
                .key(cardKey(cardId))
                .conditionExpression("#ver = :ver")
                .expressionAttributeNames(Map.of("#ver", "version"))
                .expressionAttributeValues(Map.of(":ver", num(card.getVersion())))
                .build())
            .build());

        // 2. Parent forgets the card and its votes
        if (deletion.parent() != null) {
            structural.add(removeChildFromParent(deletion.parent().getCardId(), cardId, deletion.parentContribution()));
        }

        // 3. Children become standalone
        List<TransactWriteItem> detachments = new ArrayList<>();
        for (FeedbackCard child : deletion.children()) {
            detachments.add(TransactWriteItem.builder()
                .update(Update.builder()
                    .tableName(TABLE_NAME)
                    .key(cardKey(child.getCardId()))
                    .updateExpression("REMOVE parentCardId SET updatedAt = :now, #ver = #ver + :one")
                    .conditionExpression("parentCardId = :parent")
                    .expressionAttributeNames(Map.of("#ver", "version"))
                    .expressionAttributeValues(Map.of(
                        ":parent", str(cardId),
                        ":now", InstantAsLongAttributeConverter.now(),
                        ":one", num(1)))
                    .build())
                .build());
        }

        // 4. Action cards drop their links to it
        for (ActionCard action : deletion.linkingActions()) {
            detachments.add(TransactWriteItem.builder()
                .update(Update.builder()
                    .tableName(TABLE_NAME)
                    .key(cardKey(action.getCardId()))
                    .updateExpression("DELETE linkedFeedbackIds :feedback SET #ver = #ver + :one")
                    .conditionExpression("attribute_exists(pk)")
                    .expressionAttributeNames(Map.of("#ver", "version"))
                    .expressionAttributeValues(Map.of(
                        ":feedback", strSet(cardId),
                        ":one", num(1)))
                    .build())
                .build());
        }

        List<TransactWriteItem> reactionDeletes = new ArrayList<>();
        for (Reaction reaction : deletion.reactions()) {
            reactionDeletes.add(TransactWriteItem.builder()
                .delete(Delete.builder()
                    .tableName(TABLE_NAME)
                    .key(reactionKey(reaction))
                    .build())
                .build());
        }

        if (structural.size() + detachments.size() + reactionDeletes.size() <= MAX_TRANSACTION_ITEMS) {
            List<TransactWriteItem> all = new ArrayList<>(structural);
            all.addAll(detachments);
            all.addAll(reactionDeletes);
            executeTransaction("DeleteCard", all, "card " + cardId);
            return;
        }

        // Too large for one transaction. The card delete and the parent update always commit
        // together with as many detachments as fit; the rest follow as conditional writes and
        // the reactions are swept in batches.
        int room = Math.min(detachments.size(), MAX_TRANSACTION_ITEMS - structural.size());
        structural.addAll(detachments.subList(0, room));
        executeTransaction("DeleteCard", structural, "card " + cardId);
        applyDetachments(cardId, detachments.subList(room, detachments.size()));
        if (!deletion.reactions().isEmpty()) {
            deleteReactionsInBatches(cardId, deletion.reactions());
        }
    }

    /**
     * Writes the detachments that did not fit in the delete transaction. A rejected condition
     * means the item already moved on (re-parented or deleted), so it is skipped.
     */
    private void applyDetachments(String cardId, List<TransactWriteItem> remaining) {
        if (remaining.isEmpty()) {
            return;
        }
        queryTracker.trackQuery("DeleteCardDetach", TABLE_NAME, () -> {
            int skipped = 0;
            for (TransactWriteItem item : remaining) {
                Update update = item.update();
                try {
                    dynamoDbClient.updateItem(UpdateItemRequest.builder()
                        .tableName(update.tableName())
                        .key(update.key())
                        .updateExpression(update.updateExpression())
                        .conditionExpression(update.conditionExpression())
                        .expressionAttributeNames(update.expressionAttributeNames())
                        .expressionAttributeValues(update.expressionAttributeValues())
                        .build());
                } catch (ConditionalCheckFailedException e) {
                    skipped++;
                } catch (DynamoDbException e) {
                    logger.error("Card {} deleted but detaching {} failed", cardId, update.key().get("pk").s(), e);
                    throw new RepositoryException("Failed to detach cards from deleted card", e);
                }
            }
            logger.debug("Detached {} cards from deleted card {} after commit ({} already moved)",
                remaining.size() - skipped, cardId, skipped);
            return null;
        });
    }

    private void deleteReactionsInBatches(String cardId, List<Reaction> reactions) {
        queryTracker.trackQuery("DeleteCardReactions", TABLE_NAME, () -> {
            try {
                for (int i = 0; i < reactions.size(); i += MAX_BATCH_WRITE) {
                    List<WriteRequest> writes = new ArrayList<>();
                    for (Reaction reaction : reactions.subList(i, Math.min(i + MAX_BATCH_WRITE, reactions.size()))) {
                        writes.add(WriteRequest.builder()
                            .deleteRequest(DeleteRequest.builder().key(reactionKey(reaction)).build())
                            .build());
                    }

                    Map<String, List<WriteRequest>> pending = Map.of(TABLE_NAME, writes);
                    while (!pending.isEmpty()) {
                        BatchWriteItemResponse response = dynamoDbClient.batchWriteItem(
                            BatchWriteItemRequest.builder().requestItems(pending).build());
                        pending = response.hasUnprocessedItems() ? response.unprocessedItems() : Collections.emptyMap();
                    }
                }
                logger.debug("Removed {} reactions of deleted card {}", reactions.size(), cardId);
                return null;

            } catch (DynamoDbException e) {
                logger.error("Card {} deleted but its reactions could not all be removed", cardId, e);
                throw new RepositoryException("Failed to delete reactions of card", e);
            }
        });
    }

    @Override
    public boolean replaceAggregatedCount(Card card, int aggregatedReactionCount) {
        return queryTracker.trackQuery("RecomputeAggregate", TABLE_NAME, () -> {
            try {
                UpdateItemRequest request = UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(cardKey(card.getCardId()))
                    .updateExpression("SET aggregatedReactionCount = :aggregated, #ver = #ver + :one")
                    .conditionExpression("#ver = :ver")
                    .expressionAttributeNames(Map.of("#ver", "version"))
                    .expressionAttributeValues(Map.of(
                        ":aggregated", num(aggregatedReactionCount),
                        ":ver", num(card.getVersion()),
                        ":one", num(1)))
                    .build();

                dynamoDbClient.updateItem(request);
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.debug("Card {} changed while recomputing its aggregate", card.getCardId());
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to store aggregate for card {}", card.getCardId(), e);
                throw new RepositoryException("Failed to update aggregate", e);
            }
        });
    }

    private void executeTransaction(String operation, List<TransactWriteItem> items, String description) {
        queryTracker.trackQuery(operation, TABLE_NAME, () -> {
            try {
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                    .transactItems(items)
                    .build());
                logger.debug("{} committed for {} ({} items)", operation, description, items.size());
                return null;

            } catch (TransactionCanceledException e) {
                logger.debug("{} cancelled for {}: {}", operation, description, cancellationCodes(e));
                throw new VersionConflictException(operation + " conflicted for " + description, e);
            } catch (DynamoDbException e) {
                logger.error("{} failed for {}", operation, description, e);
                throw new RepositoryException("Failed to execute " + operation, e);
            }
        });
    }

    static String cancellationCodes(TransactionCanceledException e) {
        if (!e.hasCancellationReasons()) {
            return "unknown";
        }
        StringJoiner joiner = new StringJoiner(",");
        for (CancellationReason reason : e.cancellationReasons()) {
            joiner.add(String.valueOf(reason.code()));
        }
        return joiner.toString();
    }

    private List<Card> queryAll(QueryRequest request) {
        List<Card> cards = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        do {
            QueryRequest page = startKey == null ? request : request.toBuilder().exclusiveStartKey(startKey).build();
            QueryResponse response = dynamoDbClient.query(page);
            response.items().forEach(item -> cards.add(toCard(item)));
            startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                ? response.lastEvaluatedKey() : null;
        } while (startKey != null);
        return cards;
    }

    static long countAll(DynamoDbClient client, QueryRequest request) {
        long total = 0;
        Map<String, AttributeValue> startKey = null;
        do {
            QueryRequest page = startKey == null ? request : request.toBuilder().exclusiveStartKey(startKey).build();
            QueryResponse response = client.query(page);
            total += response.count() == null ? 0 : response.count();
            startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                ? response.lastEvaluatedKey() : null;
        } while (startKey != null);
        return total;
    }

    /**
     * Pick the variant schema from the stored cardType discriminator.
     */
    Card toCard(Map<String, AttributeValue> item) {
        AttributeValue type = item.get("cardType");
        if (type != null && CardKind.ACTION.name().equals(type.s())) {
            return actionSchema.mapToItem(item);
        }
        return feedbackSchema.mapToItem(item);
    }

    private Map<String, AttributeValue> toItem(Card card) {
        // Nulls are left out so that ADD/DELETE on the set attributes work from the first link.
        if (card instanceof ActionCard action) {
            return actionSchema.itemToMap(action, true);
        }
        return feedbackSchema.itemToMap((FeedbackCard) card, true);
    }

    static Map<String, AttributeValue> cardKey(String cardId) {
        return Map.of(
            "pk", str(RetroKeyFactory.getCardPk(cardId)),
            "sk", str(RetroKeyFactory.getMetadataSk()));
    }

    static Map<String, AttributeValue> reactionKey(Reaction reaction) {
        return Map.of(
            "pk", str(RetroKeyFactory.getCardPk(reaction.getCardId())),
            "sk", str(RetroKeyFactory.getReactionSk(reaction.getUserHash())));
    }

    static AttributeValue str(String value) {
        return AttributeValue.builder().s(value).build();
    }

    static AttributeValue num(long value) {
        return AttributeValue.builder().n(Long.toString(value)).build();
    }

    static AttributeValue strSet(String value) {
        return AttributeValue.builder().ss(value).build();
    }
}
