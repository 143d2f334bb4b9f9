package io.github.flameyossnowy.geofilter.api.engine;

import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import io.github.flameyossnowy.geofilter.api.predicate.SpatialPredicate;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Combines a new filter with the subset already active on a layer.
 * A previous geometric filter is replaced rather than combined.
 * <p>
 * A subset is geometric when, outside its single-quoted string literals, it matches
 * (case-insensitively):
 * <pre>
 *   geometric := call | marker
 *   call      := \b symbol blanks '('
 *   symbol    := predicate function of PostGIS or SpatiaLite | [ST_]GeomFromText | GeomFromGPB
 *   marker    := __source | materialized view prefix
 * </pre>
 * The word boundary keeps identifiers such as {@code "ST_code"} or {@code my_within(x)}
 * attribute-only.
 */
public final class SubsetCombiner {
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");

    private final Pattern geometric;

    public SubsetCombiner(@NotNull String materializedViewPrefix) {
        StringJoiner alternatives = new StringJoiner("|");
        for (SpatialPredicate predicate : SpatialPredicate.values()) {
            for (Dialect dialect : Dialect.values()) {
                String symbol = predicate.symbol(dialect);
                if (symbol != null && dialect != Dialect.GENERIC) {
                    alternatives.add("\\b" + Pattern.quote(symbol) + "\\s*\\(");
                }
            }
        }
        alternatives.add("\\b(?:ST_)?GeomFromText\\s*\\(");
        alternatives.add("\\bGeomFromGPB\\s*\\(");
        alternatives.add("__source");
        alternatives.add(Pattern.quote(materializedViewPrefix));
        this.geometric = Pattern.compile(alternatives.toString(), Pattern.CASE_INSENSITIVE);
    }

    public boolean isGeometric(@Nullable String subset) {
        if (subset == null) {
            return false;
        }
        String unquoted = STRING_LITERAL.matcher(subset).replaceAll("''");
        return geometric.matcher(unquoted).find();
    }

    @NotNull
    public String combine(@Nullable String existing, @NotNull String filter, @Nullable CombineOperator operator) {
        if (operator == null || existing == null || existing.isBlank()) {
            return filter;
        }

        if (isGeometric(existing)) {
            Logging.info(() -> "Replacing previous geometric subset instead of combining it");
            return filter;
        }

        return "(" + existing.trim() + ")" + operator.sql() + "(" + filter + ")";
    }
}
