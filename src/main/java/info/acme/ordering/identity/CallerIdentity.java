package info.acme.ordering.identity;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The {@code (name, email)} pair of the account holder making a request, as
 * supplied by the gateway. The values are trusted as given and never
 * validated here.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class CallerIdentity {
    private static final CallerIdentity ANONYMOUS = new CallerIdentity(null, null);

    private final String name;
    private final String email;

    /**
     * An identity carrying no name or email, used when the request has no
     * usable identity.
     *
     * @return the anonymous identity.
     */
    public static CallerIdentity anonymous() {
        return ANONYMOUS;
    }

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
