package info.isaksson.erland.sttoplcopenxml.model;

import java.security.SecureRandom;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Per-conversion source of object identifiers for methods, properties and the function block.
 *
 * <p>Identifiers are version-4 UUID strings drawn from 122 random bits. An allocator never hands
 * out the same identifier twice. Instances are not thread-safe; a conversion owns its allocator.</p>
 */
public final class ObjectIdAllocator {

    private final Random random;
    private final Set<String> issued = new HashSet<>();

    private ObjectIdAllocator(Random random) {
        this.random = random;
    }

    /** Allocator backed by {@link SecureRandom}. */
    public static ObjectIdAllocator random() {
        return new ObjectIdAllocator(new SecureRandom());
    }

    /**
     * Allocator producing the same identifier sequence for the same seed.
     *
     * <p>Used for reproducible builds and byte-for-byte output comparisons.</p>
     */
    public static ObjectIdAllocator seeded(long seed) {
        return new ObjectIdAllocator(new Random(seed));
    }

    public String next() {
        while (true) {
            long msb = random.nextLong();
            long lsb = random.nextLong();
            // version 4
            msb = (msb & 0xffffffffffff0fffL) | 0x0000000000004000L;
            // IETF variant
            lsb = (lsb & 0x3fffffffffffffffL) | 0x8000000000000000L;
            String id = new UUID(msb, lsb).toString();
            if (issued.add(id)) {
                return id;
            }
        }
    }

    /**
     * Mark an identifier that already exists elsewhere (for example in a model read from JSON)
     * so that {@link #next()} never returns it.
     */
    public void reserve(String id) {
        if (id != null && !id.isBlank()) {
            issued.add(id);
        }
    }

    /** Number of identifiers handed out or reserved so far. */
    public int issuedCount() {
        return issued.size();
    }
}
