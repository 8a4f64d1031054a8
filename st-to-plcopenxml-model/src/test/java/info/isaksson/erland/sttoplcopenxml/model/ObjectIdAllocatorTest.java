package info.isaksson.erland.sttoplcopenxml.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class ObjectIdAllocatorTest {

    @Test
    void randomIdsAreDistinctVersion4Uuids() {
        ObjectIdAllocator ids = ObjectIdAllocator.random();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            String id = ids.next();
            UUID u = UUID.fromString(id);
            assertEquals(4, u.version(), id);
            assertEquals(2, u.variant(), id);
            assertTrue(seen.add(id), "duplicate id " + id);
        }
        assertEquals(500, ids.issuedCount());
    }

    @Test
    void seededAllocatorsRepeatTheirSequence() {
        List<String> a = take(ObjectIdAllocator.seeded(42L), 5);
        List<String> b = take(ObjectIdAllocator.seeded(42L), 5);
        List<String> c = take(ObjectIdAllocator.seeded(43L), 5);
        assertEquals(a, b);
        assertNotEquals(a, c);
    }

    @Test
    void reservedIdsAreSkipped() {
        String first = ObjectIdAllocator.seeded(7L).next();
        ObjectIdAllocator ids = ObjectIdAllocator.seeded(7L);
        ids.reserve(first);
        assertNotEquals(first, ids.next());
        assertEquals(2, ids.issuedCount());
    }

    private static List<String> take(ObjectIdAllocator ids, int n) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < n; i++) out.add(ids.next());
        return out;
    }
}
