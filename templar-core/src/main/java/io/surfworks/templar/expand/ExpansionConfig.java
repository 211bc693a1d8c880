package io.surfworks.templar.expand;

import java.util.Objects;

/**
 * Settings for {@link FunctionExpander}.
 *
 * @param internalPrefix prepended, together with the naming seed, to every body-local tensor name
 * @param strictFormalBinding when true, a body reference to a formal input or output the call
 *        site left unbound fails with {@link ArityException} instead of being renamed as a local
 */
public record ExpansionConfig(String internalPrefix, boolean strictFormalBinding) {

    public static final String DEFAULT_INTERNAL_PREFIX = "Func_";

    public ExpansionConfig {
        Objects.requireNonNull(internalPrefix, "internalPrefix");
    }

    /**
     * Reads {@code templar.expand.internalPrefix} and
     * {@code templar.expand.strictFormalBinding} from system properties.
     */
    public static ExpansionConfig defaults() {
        return new ExpansionConfig(
                System.getProperty("templar.expand.internalPrefix", DEFAULT_INTERNAL_PREFIX),
                Boolean.getBoolean("templar.expand.strictFormalBinding")
        );
    }

    public ExpansionConfig withStrictFormalBinding(boolean strict) {
        return new ExpansionConfig(internalPrefix, strict);
    }
}
