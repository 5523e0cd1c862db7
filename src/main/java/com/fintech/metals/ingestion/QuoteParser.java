package com.fintech.metals.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.metals.calendar.TradingCalendar;
import com.fintech.metals.domain.ContractMonth;
import com.fintech.metals.domain.QuoteSnapshot;
import com.fintech.metals.domain.SeriesFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Turns raw upstream payloads into {@link QuoteSnapshot}s.
 *
 * <p>Recognised shapes:
 * <ul>
 *   <li>contract months: {@code {"prices": {"JAN25": {"price", "site_rate_change"}}, "timestamp"}}</li>
 *   <li>flat spot: {@code {"spot_price", "price_change", "change_percentage", "last_updated"}}</li>
 *   <li>streamed reading: {@code {"success", "data": {"Value", "Rate of Change", "Timestamp"}}}</li>
 *   <li>supplier map: {@code {"Hindalco": {"amount", "sign", "last_updated"}}}</li>
 *   <li>supplier list: {@code [{"stockName", "priceChange", "timestamp"}]}</li>
 * </ul>
 *
 * <p>A payload that is not JSON or fits none of the shapes fails the whole parse. Inside
 * a recognised shape, missing or malformed numbers become {@code null} ("unknown") and
 * malformed change text becomes a zero change; neither aborts the parse.
 */
@Component
public class QuoteParser {

    private static final Logger log = LoggerFactory.getLogger(QuoteParser.class);

    private static final DateTimeFormatter SPACED_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss][.SSS]");

    private final ObjectMapper objectMapper;
    private final ZoneId zone;

    public QuoteParser(ObjectMapper objectMapper, TradingCalendar calendar) {
        this.objectMapper = objectMapper;
        this.zone = calendar.zone();
    }

    /**
     * @param raw Payload text
     * @param feed Feed the payload came from
     * @param source Provenance tag stamped on every snapshot
     * @param receivedAt Ingestion instant, used when the payload carries no usable timestamp
     * @return Snapshots in payload order; contract months sorted chronologically
     * @throws QuoteParseException if the payload is unusable as a whole
     */
    public List<QuoteSnapshot> parse(String raw, FeedDefinition feed, String source, Instant receivedAt)
            throws QuoteParseException {
        JsonNode root = readTree(raw, feed);

        if (root.isArray()) {
            return parseSupplierList(root, source, receivedAt);
        }
        if (!root.isObject()) {
            throw new QuoteParseException("Payload from feed " + feed.name() + " is not a JSON object or array");
        }
        if (root.has("prices")) {
            return parseContractMonths(root, feed, source, receivedAt);
        }
        if (root.has("spot_price") || root.has("price_change") || root.has("change_percentage")) {
            return List.of(parseFlat(root, feed, source, receivedAt));
        }
        if (root.has("data")) {
            return List.of(parseStreamed(root, feed, source, receivedAt));
        }
        if (looksLikeSupplierMap(root)) {
            return parseSupplierMap(root, source, receivedAt);
        }
        throw new QuoteParseException("Unrecognised payload shape from feed " + feed.name());
    }

    private JsonNode readTree(String raw, FeedDefinition feed) throws QuoteParseException {
        if (raw == null || raw.isBlank()) {
            throw new QuoteParseException("Empty payload from feed " + feed.name());
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new QuoteParseException("Payload from feed " + feed.name() + " is not valid JSON", e);
        }
    }

    private List<QuoteSnapshot> parseContractMonths(JsonNode root, FeedDefinition feed, String source, Instant receivedAt)
            throws QuoteParseException {
        JsonNode prices = root.get("prices");
        if (!prices.isObject() || prices.isEmpty()) {
            throw new QuoteParseException("Feed " + feed.name() + " returned no contract-month prices");
        }
        Instant observedAt = timestampOf(root, receivedAt, "timestamp", "last_updated");

        List<ContractMonth> months = new ArrayList<>();
        Iterator<String> labels = prices.fieldNames();
        while (labels.hasNext()) {
            String label = labels.next();
            if (ContractMonth.isPlaceholder(label)) {
                continue;
            }
            months.add(ContractMonth.parse(label));
        }
        // stable sort keeps payload order among unparseable labels
        months.sort(ContractMonth.CHRONOLOGICAL);

        List<QuoteSnapshot> snapshots = new ArrayList<>(months.size());
        for (ContractMonth month : months) {
            JsonNode entry = prices.get(month.label());
            if (entry == null) {
                entry = findByTrimmedName(prices, month.label());
            }
            BigDecimal price;
            RateChange change;
            if (entry != null && entry.isObject()) {
                price = decimal(entry.get("price"));
                change = RateChange.parse(text(entry.get("site_rate_change")));
            } else {
                price = decimal(entry);
                change = RateChange.ZERO;
            }
            snapshots.add(new QuoteSnapshot(
                SeriesFamily.CONTRACT_MONTH, feed.instrument(), month.label(), observedAt,
                price, change.delta(), change.deltaPercent(), source));
        }
        return snapshots;
    }

    private QuoteSnapshot parseFlat(JsonNode root, FeedDefinition feed, String source, Instant receivedAt) {
        return new QuoteSnapshot(
            feed.family(),
            feed.instrument(),
            null,
            timestampOf(root, receivedAt, "last_updated", "timestamp"),
            decimal(root.get("spot_price")),
            decimal(root.get("price_change")),
            decimal(root.get("change_percentage")),
            source
        );
    }

    private QuoteSnapshot parseStreamed(JsonNode root, FeedDefinition feed, String source, Instant receivedAt)
            throws QuoteParseException {
        JsonNode success = root.get("success");
        if (success != null && success.isBoolean() && !success.booleanValue()) {
            throw new QuoteParseException("Feed " + feed.name() + " reported success=false");
        }
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            throw new QuoteParseException("Feed " + feed.name() + " returned no data object");
        }
        RateChange change = RateChange.parse(text(data.get("Rate of Change")));
        return new QuoteSnapshot(
            feed.family(),
            feed.instrument(),
            null,
            timestampOf(data, receivedAt, "Timestamp", "timestamp"),
            decimal(data.get("Value")),
            change.delta(),
            change.deltaPercent(),
            source
        );
    }

    private boolean looksLikeSupplierMap(JsonNode root) {
        if (root.isEmpty()) {
            return false;
        }
        Iterator<JsonNode> values = root.elements();
        boolean sawEntry = false;
        while (values.hasNext()) {
            JsonNode value = values.next();
            if (value.isNull()) {
                continue;
            }
            if (!value.isObject() || !value.has("amount")) {
                return false;
            }
            sawEntry = true;
        }
        return sawEntry;
    }

    private List<QuoteSnapshot> parseSupplierMap(JsonNode root, String source, Instant receivedAt) {
        List<QuoteSnapshot> snapshots = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode entry = field.getValue();
            if (entry.isNull()) {
                continue;
            }
            BigDecimal amount = decimal(entry.get("amount"));
            if (amount != null && "-".equals(text(entry.get("sign")))) {
                amount = amount.negate();
            }
            snapshots.add(supplierSnapshot(field.getKey(), amount,
                timestampOf(entry, receivedAt, "last_updated", "timestamp"), source));
        }
        return snapshots;
    }

    private List<QuoteSnapshot> parseSupplierList(JsonNode root, String source, Instant receivedAt) {
        List<QuoteSnapshot> snapshots = new ArrayList<>();
        for (JsonNode entry : root) {
            String name = text(entry.get("stockName"));
            if (name == null || name.isBlank()) {
                log.debug("Skipping supplier entry without stockName");
                continue;
            }
            snapshots.add(supplierSnapshot(name.trim(), decimal(entry.get("priceChange")),
                timestampOf(entry, receivedAt, "timestamp", "last_updated"), source));
        }
        // oldest first so cumulative pricing applies updates in order
        snapshots.sort(Comparator.comparing(QuoteSnapshot::observedAt));
        return snapshots;
    }

    private QuoteSnapshot supplierSnapshot(String name, BigDecimal change, Instant observedAt, String source) {
        // price is worked out later from the stored running total
        return new QuoteSnapshot(SeriesFamily.SUPPLIER, name, null, observedAt, null, change, null, source);
    }

    private JsonNode findByTrimmedName(JsonNode object, String trimmed) {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().trim().equals(trimmed)) {
                return field.getValue();
            }
        }
        return null;
    }

    private Instant timestampOf(JsonNode node, Instant fallback, String... fieldNames) {
        for (String fieldName : fieldNames) {
            Optional<Instant> parsed = parseTimestamp(node.get(fieldName));
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        // some feeds split the reading time into date and time fields
        String date = text(node.get("date"));
        String time = text(node.get("time"));
        if (date != null && time != null) {
            try {
                return LocalDate.parse(date.trim()).atTime(LocalTime.parse(time.trim())).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                log.debug("Unparseable date/time pair '{}' '{}', using ingestion time", date, time);
            }
        }
        return fallback;
    }

    /**
     * Accepts ISO instants, offset date-times, zone-less date-times (read in the calendar
     * zone) and epoch milliseconds.
     */
    Optional<Instant> parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (node.isIntegralNumber()) {
            return Optional.of(Instant.ofEpochMilli(node.longValue()));
        }
        String value = node.asText().trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Optional<Instant> parsed = attempt(() -> OffsetDateTime.parse(value).toInstant())
            .or(() -> attempt(() -> LocalDateTime.parse(value).atZone(zone).toInstant()))
            .or(() -> attempt(() -> LocalDateTime.parse(value, SPACED_DATE_TIME).atZone(zone).toInstant()));
        if (parsed.isEmpty()) {
            log.debug("Unparseable timestamp '{}', using ingestion time", value);
        }
        return parsed;
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Reads a price-like value. Strings may carry thousands separators. Anything absent
     * or not numeric is {@code null}.
     */
    static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (!node.isTextual()) {
            return null;
        }
        String cleaned = node.asText().replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
