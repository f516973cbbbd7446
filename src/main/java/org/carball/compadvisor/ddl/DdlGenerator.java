package org.carball.compadvisor.ddl;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.model.Encoding;
import org.carball.compadvisor.model.ObjectRef;
import org.carball.compadvisor.model.Recommendation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns recommendations into storage-change statements.
 * <p>
 * Generation has no side effects and the same input always gives byte-identical text. Input that
 * no template covers yields a comment starting with {@value #PLACEHOLDER_PREFIX} instead of an
 * exception, so a listing over many recommendations never stops partway.
 */
@Slf4j
public class DdlGenerator {

    public static final String PLACEHOLDER_PREFIX = "-- ";

    public String generate(Recommendation recommendation) {
        return generate(recommendation, false);
    }

    public String generate(Recommendation recommendation, boolean online) {
        ObjectRef ref = recommendation.getRef();
        if (ref == null || ref.objectType() == null) {
            return PLACEHOLDER_PREFIX + "Unknown object type for recommendation " + recommendation.getId();
        }
        Encoding encoding = recommendation.getRecommendedEncoding();
        if (encoding == null || encoding == Encoding.NONE) {
            return PLACEHOLDER_PREFIX + "No storage change recommended for " + ref;
        }
        return statementFor(ref, encoding, recommendation.getStorageArea(), online);
    }

    /**
     * Statement that puts {@code ref} into {@code encoding}; NONE renders an explicit NOCOMPRESS change.
     */
    public String statementFor(ObjectRef ref, Encoding encoding, String storageArea, boolean online) {
        if (!encoding.appliesTo(ref.objectType())) {
            log.warn("Encoding {} does not apply to {} {}", encoding, ref.objectType(), ref);
            return PLACEHOLDER_PREFIX + "Encoding " + encoding + " does not apply to "
                    + ref.objectType().name() + " " + ref;
        }
        return DdlTemplate.forRef(ref).render(new DdlRequest(ref, encoding, storageArea, online));
    }

    /**
     * Rebuild of an index left unusable by a table move; the index keeps its own compression.
     */
    public String rebuildIndex(ObjectRef index, boolean online) {
        return "ALTER INDEX " + index.qualifiedName() + " REBUILD" + (online ? " ONLINE" : "") + ";";
    }

    /**
     * Statements for a listing, in the given order.
     */
    public List<String> generateAll(List<Recommendation> recommendations, boolean online) {
        List<String> statements = new ArrayList<>();
        for (Recommendation recommendation : recommendations) {
            statements.add(generate(recommendation, online));
        }
        return statements;
    }

    public static boolean isPlaceholder(String statement) {
        return statement == null || statement.startsWith(PLACEHOLDER_PREFIX);
    }

    /**
     * Structural check of a statement before it is run: the expected template prefix, the target
     * object, the storage clause and a single terminated statement.
     *
     * @return problems found; empty when the statement is well formed
     */
    public List<String> validate(String statement, ObjectRef ref, Encoding encoding) {
        List<String> problems = new ArrayList<>();
        if (isPlaceholder(statement)) {
            problems.add("No executable statement: " + statement);
            return problems;
        }
        String upper = statement.toUpperCase(Locale.ROOT);
        DdlTemplate template = DdlTemplate.forRef(ref);

        if (!upper.startsWith(template.getPrefix())) {
            problems.add("Expected statement starting with '" + template.getPrefix().trim() + "'");
        }
        String target = (ref.owner() + "." + ref.objectName()).toUpperCase(Locale.ROOT);
        if (!upper.contains(target)) {
            problems.add("Statement does not reference " + target);
        }
        if (ref.isPartition() && !upper.contains("PARTITION " + ref.partitionName().toUpperCase(Locale.ROOT))) {
            problems.add("Statement does not reference partition " + ref.partitionName());
        }
        if (!upper.contains(encoding.getStorageClause())) {
            problems.add("Statement does not contain '" + encoding.getStorageClause() + "'");
        }
        int terminator = statement.indexOf(';');
        if (terminator != statement.length() - 1) {
            problems.add("Expected exactly one statement terminated by ';'");
        }
        return problems;
    }
}
