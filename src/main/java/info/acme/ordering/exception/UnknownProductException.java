package info.acme.ordering.exception;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * Thrown when an order references product ids that are not in the catalog.
 */
@Getter
public class UnknownProductException extends RuntimeException {
    private final List<Long> missingProductIds;

    public UnknownProductException(Collection<Long> missingProductIds) {
        super("one or more invalid product ids: " + missingProductIds.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ")));
        this.missingProductIds = List.copyOf(missingProductIds);
    }
}
