package analysis.lifetime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Recognizes callees with a known effect on resource lifetimes by (sub)string matching on the callee name. Callee
 * bodies are never analyzed.
 */
public class CalleeClassifier {

    /**
     * Callees that release their first argument, matched as substrings
     */
    private static final List<String> RELEASE_CALLEES = Arrays.asList("::drop", "mem::drop", "drop_in_place");
    /**
     * Callee that releases its first argument, matched exactly
     */
    private static final String RELEASE_CALLEE_EXACT = "drop";
    /**
     * Callees whose result points into their first argument
     */
    private static final List<String> ALIAS_CALLEES = Arrays.asList("as_mut_ptr", "as_ptr", "as_ref", "as_mut",
                                                                    "from_raw_parts", "into_raw", "from_raw",
                                                                    "_as_raw", "::deref");
    /**
     * Callees whose result is the address of a (usually static) place
     */
    private static final List<String> STATIC_ADDRESS_CALLEES = Arrays.asList("addr_of", "addr_of_mut");

    private final List<String> extraReleaseCallees;

    /**
     * Classifier using only the built-in names
     */
    public CalleeClassifier() {
        this(Collections.<String> emptyList());
    }

    /**
     * Classifier that also treats callees containing any of the given names as releasing their first argument
     *
     * @param extraReleaseCallees
     *            additional release callee names
     */
    public CalleeClassifier(Collection<String> extraReleaseCallees) {
        this.extraReleaseCallees = Collections.unmodifiableList(new ArrayList<>(extraReleaseCallees));
    }

    /**
     * Whether the callee releases its first argument
     *
     * @param callee
     *            callee name
     * @return true for drop-like functions
     */
    public boolean isExplicitRelease(String callee) {
        if (callee.equals(RELEASE_CALLEE_EXACT)) {
            return true;
        }
        return containsAny(callee, RELEASE_CALLEES) || containsAny(callee, extraReleaseCallees);
    }

    /**
     * Whether the callee returns a pointer or reference into its first argument
     *
     * @param callee
     *            callee name
     * @return true for accessor and conversion functions that produce aliases
     */
    public boolean isAliasProducing(String callee) {
        return containsAny(callee, ALIAS_CALLEES);
    }

    /**
     * Whether the callee returns the address of its argument without taking ownership
     *
     * @param callee
     *            callee name
     * @return true for address-of helpers
     */
    public boolean isStaticAddressOf(String callee) {
        return containsAny(callee, STATIC_ADDRESS_CALLEES);
    }

    public List<String> getExtraReleaseCallees() {
        return extraReleaseCallees;
    }

    private static boolean containsAny(String callee, List<String> names) {
        for (String n : names) {
            if (callee.contains(n)) {
                return true;
            }
        }
        return false;
    }
}
