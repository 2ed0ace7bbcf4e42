package dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link StreamNameBuilder} that generates stream names using the format <code>[lowercaseprefix.]camelCaseAggregateName-id</code>,
 * where the id is the aggregate id without dashes.<br>
 * Example: <code>bank.account-0f8fad5bd9cb469fa16570867728950e</code>
 */
public class PrefixedCamelCaseStreamNameBuilder implements StreamNameBuilder {
    private final Optional<String> prefix;

    /**
     * Create a builder that generates stream names without a prefix
     */
    public PrefixedCamelCaseStreamNameBuilder() {
        this.prefix = Optional.empty();
    }

    /**
     * Create a builder that generates stream names with a prefix
     *
     * @param prefix the prefix. Must not be blank - use {@link #PrefixedCamelCaseStreamNameBuilder()} if you don't want a prefix
     */
    public PrefixedCamelCaseStreamNameBuilder(String prefix) {
        requireNonNull(prefix, "No prefix provided");
        requireFalse(prefix.isBlank(), "Provide a non blank prefix or use the default constructor instead");
        this.prefix = Optional.of(prefix.toLowerCase(Locale.ROOT));
    }

    @Override
    public StreamName generateForAggregate(Class<?> aggregateType, UUID aggregateId) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        return StreamName.of(msg("{}{}-{}",
                                 prefix.map(p -> p + ".").orElse(""),
                                 toCamelCase(aggregateType.getSimpleName()),
                                 aggregateId.toString().replace("-", "")));
    }

    private static String toCamelCase(String name) {
        if (name.length() <= 1) {
            return name.toLowerCase(Locale.ROOT);
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    @Override
    public String toString() {
        return "PrefixedCamelCaseStreamNameBuilder{" +
                "prefix=" + prefix +
                '}';
    }
}
