package work.cellium.kernel.demo;

import java.util.List;
import java.util.Map;
import work.cellium.kernel.process.WorkTask;

/**
 * CPU-bound demo task: counts the primes below {@code args[0]} with a sieve.
 */
public final class PrimeCountTask implements WorkTask {
    static final long MAX_LIMIT = 50_000_000L;

    @Override
    public Object run(List<Object> args, Map<String, Object> kwargs) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException("missing upper bound");
        }
        long limit = toLong(args.get(0));
        if (limit < 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("upper bound must be between 0 and " + MAX_LIMIT + ": " + limit);
        }
        return countBelow((int) limit);
    }

    static int countBelow(int limit) {
        if (limit < 3) {
            return 0;
        }
        var composite = new boolean[limit];
        int count = 0;
        for (int i = 2; i < limit; i++) {
            if (composite[i]) {
                continue;
            }
            count++;
            for (long j = (long) i * i; j < limit; j += i) {
                composite[(int) j] = true;
            }
        }
        return count;
    }

    private static long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("not an integer: " + value, ex);
        }
    }
}
