package ai.flowgraph.common;

import java.security.SecureRandom;
import java.util.random.RandomGenerator;

public class RandomIdGenerator implements IdGenerator {
    private static final String SYMBOLS = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final RandomGenerator RND = new SecureRandom();

    private final int length;

    public RandomIdGenerator() {
        this(12);
    }

    public RandomIdGenerator(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Id length must be positive, got " + length);
        }
        this.length = length;
    }

    @Override
    public String generate(String prefix) {
        var buf = new char[length];
        for (int i = 0; i < length; ++i) {
            buf[i] = SYMBOLS.charAt(RND.nextInt(SYMBOLS.length()));
        }
        return prefix + "-" + new String(buf);
    }
}
