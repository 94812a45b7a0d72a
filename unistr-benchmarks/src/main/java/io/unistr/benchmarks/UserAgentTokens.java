package io.unistr.benchmarks;

/**
 * Synthetic field values shaped like the output of a user-agent classifier:
 * a small family vocabulary and version fragments repeated many times.
 */
final class UserAgentTokens {

    private static final String[] FAMILIES = {
            "Chrome", "Firefox", "Safari", "Mobile Safari", "Edge", "Opera", "Samsung Internet",
            "Chrome Mobile", "Firefox Mobile", "UC Browser", "Android", "iOS", "Windows", "Mac OS X",
            "Linux", "Ubuntu", "Samsung", "Apple", "Huawei", "Xiaomi", "Generic Smartphone"
    };

    private UserAgentTokens() {
    }

    /**
     * Build {@code count} tokens with roughly {@code distinct} different values.
     */
    static String[] generate(int count, int distinct) {
        String[] tokens = new String[count];
        for (int i = 0; i < count; i++) {
            int id = i % distinct;
            String family = FAMILIES[id % FAMILIES.length];
            tokens[i] = id < FAMILIES.length ? family : family + " " + (id / FAMILIES.length);
        }
        return tokens;
    }
}
