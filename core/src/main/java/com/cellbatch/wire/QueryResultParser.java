package com.cellbatch.wire;

import com.cellbatch.batch.CellsBatch;
import com.cellbatch.batch.QueryResult;
import com.cellbatch.exception.WireFormatException;
import com.cellbatch.wire.proto.QueryResultProtos;
import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts serialized {@code QueryResult} messages into the {@link QueryResult} model.
 *
 * <p>The engine may split one query's result over several messages. Only the first
 * message carries the column names; batches accumulate across messages. Cell tags are
 * copied as raw wire values, so tags unknown to this version survive until decoding
 * reports them.
 */
public final class QueryResultParser {

    private static final Logger logger = LoggerFactory.getLogger(QueryResultParser.class);

    private QueryResultParser() {} // Utility class

    /**
     * Parses one serialized message.
     *
     * @param bytes the message bytes
     * @return the query result
     * @throws WireFormatException if the bytes are not a valid message
     */
    public static QueryResult parse(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return parseChunks(List.of(bytes));
    }

    /**
     * Parses one serialized message read to the end of the stream.
     *
     * @param input the stream to read; not closed by this method
     * @return the query result
     * @throws IOException if reading the stream fails
     * @throws WireFormatException if the bytes are not a valid message
     */
    public static QueryResult parse(InputStream input) throws IOException {
        Objects.requireNonNull(input, "input must not be null");
        QueryResultProtos.QueryResult message;
        try {
            message = QueryResultProtos.QueryResult.parseFrom(input);
        } catch (InvalidProtocolBufferException e) {
            throw new WireFormatException("Malformed query result message: " + e.getMessage(), e);
        }
        return fromMessages(List.of(message));
    }

    /**
     * Parses the messages of one query, in the order they were received.
     *
     * @param chunks the serialized messages
     * @return the combined query result
     * @throws WireFormatException if any chunk is not a valid message
     */
    public static QueryResult parseChunks(List<byte[]> chunks) {
        Objects.requireNonNull(chunks, "chunks must not be null");
        List<QueryResultProtos.QueryResult> messages = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            try {
                messages.add(QueryResultProtos.QueryResult.parseFrom(chunks.get(i)));
            } catch (InvalidProtocolBufferException e) {
                throw new WireFormatException("Malformed query result message in chunk " + i + ": " + e.getMessage(), e);
            }
        }
        return fromMessages(messages);
    }

    /**
     * Combines already parsed messages of one query.
     *
     * <p>Column names are taken from the first message that has any, batches are
     * concatenated in order and the first error reported wins.
     *
     * @param messages the messages, in the order they were received
     * @return the combined query result
     */
    public static QueryResult fromMessages(List<QueryResultProtos.QueryResult> messages) {
        List<String> columnNames = null;
        String error = null;
        List<CellsBatch> batches = new ArrayList<>();

        for (QueryResultProtos.QueryResult message : messages) {
            if (columnNames == null && message.getColumnNamesCount() > 0) {
                columnNames = message.getColumnNamesList();
            }
            if (error == null && message.hasError() && !message.getError().isEmpty()) {
                error = message.getError();
            }
            for (QueryResultProtos.CellsBatch batch : message.getBatchList()) {
                batches.add(toBatch(batch));
            }
        }

        logger.debug("Parsed {} messages: {} columns, {} batches{}",
            messages.size(), columnNames != null ? columnNames.size() : 0, batches.size(),
            error != null ? ", engine error" : "");
        return new QueryResult(columnNames != null ? columnNames : List.of(), error, batches);
    }

    /**
     * Converts a single batch message.
     *
     * @param message the batch message
     * @return the batch
     */
    public static CellsBatch toBatch(QueryResultProtos.CellsBatch message) {
        CellsBatch.Builder builder = CellsBatch.builder();
        for (int tag : message.getCellsValueList()) {
            builder.addRawCell(tag);
        }
        for (long value : message.getVarintCellsList()) {
            builder.addVarints(value);
        }
        for (double value : message.getFloat64CellsList()) {
            builder.addFloat64s(value);
        }
        for (ByteString blob : message.getBlobCellsList()) {
            builder.addBlob(blob.toByteArray());
        }
        if (message.hasStringCells()) {
            builder.stringCells(message.getStringCells());
        }
        return builder.lastBatch(message.getIsLastBatch()).build();
    }
}
