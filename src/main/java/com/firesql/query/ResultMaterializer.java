package com.firesql.query;

import com.firesql.domain.Document;
import com.firesql.domain.ExecutionResult;
import com.firesql.domain.FieldType;
import com.firesql.domain.FieldValue;
import com.firesql.domain.Frame;
import com.firesql.domain.FrameField;
import com.firesql.domain.ValueKind;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns documents, aggregated rows or delegated records into a typed {@link Frame}.
 *
 * Document columns are strings except the time field, which is temporal with
 * unconvertible values falling back to the epoch. Aggregate columns are float64.
 * Empty results still carry the requested columns.
 */
@Component
public class ResultMaterializer {

    static final String WILDCARD = "*";
    static final String NO_DATA_COLUMN = "no_data";
    static final Instant ZERO_TIME = Instant.EPOCH;

    /**
     * Materialize the documents of a non-aggregating plan.
     *
     * @param documents retrieved and filtered documents
     * @param plan the plan whose fields are selected
     * @param timeField field emitted as a time column, may be null
     */
    public Frame fromDocuments(List<Document> documents, QueryPlan plan, String timeField) {
        Frame frame = new Frame();
        List<Document> rows = documents.stream().filter(Objects::nonNull).collect(Collectors.toList());

        if (rows.isEmpty()) {
            for (String field : plan.getFields()) {
                if (WILDCARD.equals(field)) {
                    frame.addField(new FrameField(NO_DATA_COLUMN, FieldType.STRING));
                    break;
                }
                frame.addField(new FrameField(field, field.equals(timeField) ? FieldType.TIME : FieldType.STRING));
            }
            return frame;
        }

        for (String field : expandFields(plan.getFields(), rows)) {
            if (field.equals(timeField)) {
                FrameField column = new FrameField(field, FieldType.TIME);
                for (Document row : rows) {
                    column.append(row.resolve(field).toInstant().orElse(ZERO_TIME));
                }
                frame.addField(column);
            } else {
                FrameField column = new FrameField(field, FieldType.STRING);
                for (Document row : rows) {
                    column.append(row.resolve(field).asText());
                }
                frame.addField(column);
            }
        }
        return frame;
    }

    /**
     * Replace each wildcard with every field name seen across the documents.
     * The order of expanded names is not guaranteed.
     */
    static List<String> expandFields(List<String> fields, List<Document> documents) {
        Set<String> expanded = new LinkedHashSet<>();
        for (String field : fields) {
            if (WILDCARD.equals(field)) {
                for (Document document : documents) {
                    expanded.addAll(document.fieldNames());
                }
            } else {
                expanded.add(field);
            }
        }
        return new ArrayList<>(expanded);
    }

    /**
     * Materialize aggregated rows: group-by columns as strings, then one float64
     * column per aggregate named by its cleaned alias.
     */
    public Frame fromAggregates(List<AggregatedResult> results, QueryPlan plan) {
        Frame frame = new Frame();

        List<String> groupByFields = plan.getGroupByFields();
        for (int i = 0; i < groupByFields.size(); i++) {
            FrameField column = new FrameField(groupByFields.get(i), FieldType.STRING);
            for (AggregatedResult result : results) {
                column.append(result.getGroupValues().get(i).asText());
            }
            frame.addField(column);
        }

        List<AggregateInfo> aggregates = plan.getAggregateFields();
        for (int i = 0; i < aggregates.size(); i++) {
            FrameField column = new FrameField(aggregates.get(i).getColumnName(), FieldType.FLOAT64);
            for (AggregatedResult result : results) {
                column.append(result.getAggregateValues().get(i));
            }
            frame.addField(column);
        }
        return frame;
    }

    /**
     * Materialize row-major records from the delegated executor. Each column is
     * typed after its non-null values; mixed columns become strings. Missing
     * cells are kept as nulls.
     */
    public Frame fromRecords(ExecutionResult result) {
        Frame frame = new Frame();
        List<List<Object>> records = result.getRecords().stream()
            .filter(Objects::nonNull)
            .collect(Collectors.toList());

        List<String> columns = result.getColumns();
        for (int c = 0; c < columns.size(); c++) {
            List<FieldValue> cells = new ArrayList<>(records.size());
            for (List<Object> record : records) {
                cells.add(c < record.size() ? FieldValue.of(record.get(c)) : FieldValue.NULL);
            }

            FieldType type = columnType(cells);
            FrameField column = new FrameField(columns.get(c), type);
            for (FieldValue cell : cells) {
                column.append(cell.isNull() ? null : cellValue(cell, type));
            }
            frame.addField(column);
        }
        return frame;
    }

    private static FieldType columnType(List<FieldValue> cells) {
        Set<ValueKind> kinds = EnumSet.noneOf(ValueKind.class);
        for (FieldValue cell : cells) {
            if (!cell.isNull()) {
                kinds.add(cell.kind() == ValueKind.SEQUENCE ? ValueKind.MAPPING : cell.kind());
            }
        }
        if (kinds.size() != 1) {
            return FieldType.STRING;
        }
        switch (kinds.iterator().next()) {
            case BOOL:
                return FieldType.BOOLEAN;
            case INT64:
                return FieldType.INT64;
            case FLOAT64:
                return FieldType.FLOAT64;
            case TIMESTAMP:
                return FieldType.TIME;
            case MAPPING:
                return FieldType.JSON;
            default:
                return FieldType.STRING;
        }
    }

    private static Object cellValue(FieldValue cell, FieldType type) {
        switch (type) {
            case BOOLEAN:
            case INT64:
            case FLOAT64:
            case TIME:
                return cell.raw();
            default:
                return cell.asText();
        }
    }
}
