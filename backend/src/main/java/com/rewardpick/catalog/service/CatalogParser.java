package com.rewardpick.catalog.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.rewardpick.catalog.model.CardRecord;
import com.rewardpick.catalog.model.IndexDocument;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CatalogParser {

    private static final Logger log = LoggerFactory.getLogger(CatalogParser.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";
    private static final Pattern RATE_PATTERN = Pattern.compile("^([+-]?[0-9]+(?:\\.[0-9]+)?)\\s*%?$");
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("yyyy/MM/dd"),
        DateTimeFormatter.ofPattern("yyyy/M/d")
    );
    private static final Set<String> NO_EXPIRY_VALUES = Set.of("", "ongoing", "longterm", "none", "n/a", "nan", "長期", "無");
    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "y", "1", "required", "需要", "是", "需切換");
    private static final Set<String> FALSE_VALUES = Set.of(
        "false", "no", "n", "0", "none", "notrequired", "否", "不需要", "無需切換", "無", "免切換"
    );

    private final CategoryCatalog categoryCatalog;
    private final CsvMapper csvMapper;

    public CatalogParser(CategoryCatalog categoryCatalog) {
        this.categoryCatalog = categoryCatalog;
        this.csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();
    }

    /**
     * Parses a catalog file into card records, one per distinct card name. Rows sharing a card
     * name contribute one reward category each.
     *
     * @throws MalformedCatalogException for the first row that cannot be parsed
     */
    public List<CardRecord> parse(byte[] rawBytes) {
        if (rawBytes == null || rawBytes.length == 0) {
            throw new MalformedCatalogException(1, "catalog file is empty");
        }

        List<String[]> rows = readRows(stripByteOrderMark(new String(rawBytes, StandardCharsets.UTF_8)));
        if (rows.isEmpty()) {
            throw new MalformedCatalogException(1, "catalog file has no header row");
        }

        Map<Column, Integer> layout = resolveLayout(rows.get(0));
        Map<String, CardBuilder> builders = new LinkedHashMap<>();

        for (int index = 1; index < rows.size(); index++) {
            String[] row = rows.get(index);
            if (isBlankRow(row)) {
                continue;
            }

            int rowNumber = index + 1;
            String name = cell(row, layout, Column.NAME);
            if (name.isBlank()) {
                throw new MalformedCatalogException(rowNumber, "missing card name");
            }

            String category = categoryCatalog.canonicalize(cell(row, layout, Column.CATEGORY));
            if (category.isBlank()) {
                throw new MalformedCatalogException(rowNumber, "missing reward category for card '" + name + "'");
            }

            double rate = parseRate(rowNumber, name, cell(row, layout, Column.RATE));
            boolean activationRequired = parseActivation(rowNumber, name, cell(row, layout, Column.ACTIVATION));
            LocalDate validUntil = parseDate(rowNumber, name, cell(row, layout, Column.VALID_UNTIL));

            builders.computeIfAbsent(name, CardBuilder::new).accept(
                category,
                rate,
                activationRequired,
                validUntil,
                cell(row, layout, Column.CONDITIONS),
                cell(row, layout, Column.ISSUER),
                cell(row, layout, Column.ANNUAL_FEE)
            );
        }

        List<CardRecord> cards = builders.values().stream().map(CardBuilder::build).toList();
        log.debug("Parsed catalog (rows={}, cards={})", rows.size() - 1, cards.size());
        return cards;
    }

    public List<IndexDocument> toDocuments(List<CardRecord> cards) {
        return cards.stream().map(this::toDocument).toList();
    }

    public IndexDocument toDocument(CardRecord card) {
        StringBuilder text = new StringBuilder();
        text.append("Card: ").append(card.name()).append('\n');
        if (!card.issuer().isBlank()) {
            text.append("Issuer: ").append(card.issuer()).append('\n');
        }

        text.append("Rewards:\n");
        for (Map.Entry<String, Double> reward : card.rewards().entrySet()) {
            text.append("- ").append(reward.getKey()).append(": ").append(formatRate(reward.getValue())).append("%\n");
        }

        text.append("Activation: ").append(activationCaveat(card.activationRequired())).append('\n');
        text.append("Valid until: ").append(card.validUntil() == null ? "no expiry" : card.validUntil()).append('\n');
        if (!card.annualFeeText().isBlank()) {
            text.append("Annual fee: ").append(card.annualFeeText()).append('\n');
        }
        if (!card.conditions().isBlank()) {
            text.append("Conditions: ").append(card.conditions()).append('\n');
        }

        return new IndexDocument(
            card.name(),
            text.toString().trim(),
            new IndexDocument.Metadata(card.categories(), card.activationRequired(), card.validUntil()),
            card
        );
    }

    public static String activationCaveat(boolean activationRequired) {
        return activationRequired
            ? "requires switching to the matching reward plan in the issuer's app before spending"
            : "no plan switch required";
    }

    public static String formatRate(double rate) {
        return BigDecimal.valueOf(rate).stripTrailingZeros().toPlainString();
    }

    private List<String[]> readRows(String text) {
        try (MappingIterator<String[]> iterator = csvMapper.readerFor(String[].class).readValues(text)) {
            return iterator.readAll();
        } catch (IOException | RuntimeJsonMappingException exception) {
            throw new MalformedCatalogException(1, "unreadable CSV content (" + exception.getMessage() + ")", exception);
        }
    }

    private Map<Column, Integer> resolveLayout(String[] header) {
        Map<Column, Integer> layout = new EnumMap<>(Column.class);
        for (int index = 0; index < header.length; index++) {
            String normalized = normalizeHeader(header[index]);
            for (Column column : Column.values()) {
                if (!layout.containsKey(column) && column.aliases.contains(normalized)) {
                    layout.put(column, index);
                }
            }
        }

        List<String> missing = new ArrayList<>();
        for (Column column : Column.values()) {
            if (column.required && !layout.containsKey(column)) {
                missing.add(column.label);
            }
        }
        if (!missing.isEmpty()) {
            throw new MalformedCatalogException(1, "missing required column(s) " + String.join(", ", missing));
        }
        return layout;
    }

    private double parseRate(int rowNumber, String name, String raw) {
        if (raw.isBlank()) {
            throw new MalformedCatalogException(rowNumber, "missing reward rate for card '" + name + "'");
        }

        Matcher matcher = RATE_PATTERN.matcher(raw.trim());
        if (!matcher.matches()) {
            throw new MalformedCatalogException(rowNumber, "unparsable reward rate '" + raw + "' for card '" + name + "'");
        }

        double rate = Double.parseDouble(matcher.group(1));
        if (rate < 0) {
            throw new MalformedCatalogException(rowNumber, "negative reward rate '" + raw + "' for card '" + name + "'");
        }
        return rate;
    }

    private boolean parseActivation(int rowNumber, String name, String raw) {
        String normalized = raw.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
        if (TRUE_VALUES.contains(normalized)) {
            return true;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return false;
        }
        // plan descriptions such as "無需切換" or "切換至數位生活方案"
        if (normalized.contains("無需") || normalized.contains("不需") || normalized.contains("免切換")) {
            return false;
        }
        if (normalized.contains("切換")) {
            return true;
        }
        throw new MalformedCatalogException(
            rowNumber,
            "unparsable activation flag '" + raw + "' for card '" + name + "'"
        );
    }

    private LocalDate parseDate(int rowNumber, String name, String raw) {
        String normalized = raw.toLowerCase(Locale.ROOT).replaceAll("[\\s_-]+", "");
        if (NO_EXPIRY_VALUES.contains(normalized)) {
            return null;
        }

        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(raw.trim(), format);
            } catch (DateTimeParseException exception) {
                log.trace("Date '{}' does not match {}", raw, format);
            }
        }
        throw new MalformedCatalogException(rowNumber, "unparsable expiry date '" + raw + "' for card '" + name + "'");
    }

    private String cell(String[] row, Map<Column, Integer> layout, Column column) {
        Integer index = layout.get(column);
        if (index == null || index >= row.length || row[index] == null) {
            return "";
        }
        return row[index].trim();
    }

    private boolean isBlankRow(String[] row) {
        for (String value : row) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private String stripByteOrderMark(String text) {
        return text.startsWith(BYTE_ORDER_MARK) ? text.substring(1) : text;
    }

    private static String normalizeHeader(String value) {
        if (value == null) {
            return "";
        }
        return value.replace(BYTE_ORDER_MARK, "")
            .toLowerCase(Locale.ROOT)
            .replaceAll("[\\s_-]+", "");
    }

    private enum Column {
        NAME("card name", true, "cardname", "name", "card", "信用卡名稱", "卡片名稱", "卡名"),
        CATEGORY("reward category", true, "category", "rewardcategory", "回饋類別", "消費類別", "類別"),
        RATE("reward rate", true, "rate", "rewardrate", "cashbackrate", "回饋率", "回饋比例"),
        ACTIVATION(
            "activation required",
            true,
            "activationrequired", "activation", "requiresactivation", "planswitch", "app切換方案", "app切換", "需切換"
        ),
        VALID_UNTIL("valid until", false, "validuntil", "expiry", "expirydate", "expires", "enddate", "回饋到期日", "到期日"),
        CONDITIONS("conditions", false, "conditions", "condition", "notes", "note", "remarks", "備註", "條件"),
        ISSUER("issuer", false, "issuer", "bank", "銀行", "發卡銀行"),
        ANNUAL_FEE("annual fee", false, "annualfee", "fee", "年費");

        private final String label;
        private final boolean required;
        private final Set<String> aliases;

        Column(String label, boolean required, String... aliases) {
            this.label = label;
            this.required = required;
            this.aliases = Set.of(aliases);
        }
    }

    private static final class CardBuilder {

        private final String name;
        private final Map<String, Double> rewards = new LinkedHashMap<>();
        private final Set<String> conditions = new LinkedHashSet<>();
        private boolean activationRequired;
        private LocalDate validUntil;
        private String issuer = "";
        private String annualFeeText = "";

        private CardBuilder(String name) {
            this.name = name;
        }

        private void accept(
            String category,
            double rate,
            boolean rowActivationRequired,
            LocalDate rowValidUntil,
            String rowConditions,
            String rowIssuer,
            String rowAnnualFee
        ) {
            rewards.merge(category, rate, Math::max);
            activationRequired = activationRequired || rowActivationRequired;
            if (rowValidUntil != null && (validUntil == null || rowValidUntil.isBefore(validUntil))) {
                validUntil = rowValidUntil;
            }
            if (!rowConditions.isBlank()) {
                conditions.add(rowConditions);
            }
            if (issuer.isBlank()) {
                issuer = rowIssuer;
            }
            if (annualFeeText.isBlank()) {
                annualFeeText = rowAnnualFee;
            }
        }

        private CardRecord build() {
            return new CardRecord(
                name,
                issuer,
                rewards,
                activationRequired,
                validUntil,
                String.join("; ", conditions),
                annualFeeText
            );
        }
    }
}
