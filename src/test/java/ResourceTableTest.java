import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class ResourceTableTest {

    @Test
    void freeResourceIsGrantedAndOwnedResourceQueues() {
        ResourceTable table = new ResourceTable(3);

        assertEquals(ResourceTable.Outcome.GRANTED, table.tryAcquire(1, "A"));
        assertEquals(ResourceTable.Outcome.ENQUEUED, table.tryAcquire(1, "B"));
        assertEquals("A", table.ownerOf(1));
        assertEquals(List.of("B"), table.waitersOf(1));
        assertEquals(1, table.awaitedBy("B"));
        assertNull(table.awaitedBy("A"));
    }

    @Test
    void rerequestIsIdempotent() {
        ResourceTable table = new ResourceTable(3);
        table.tryAcquire(2, "A");
        table.tryAcquire(2, "B");

        assertEquals(ResourceTable.Outcome.GRANTED, table.tryAcquire(2, "A"));
        assertEquals(ResourceTable.Outcome.ENQUEUED, table.tryAcquire(2, "B"));
        assertEquals(List.of("B"), table.waitersOf(2));
    }

    @Test
    void releaseAllHandsOnInFifoOrder() {
        ResourceTable table = new ResourceTable(3);
        table.tryAcquire(0, "A");
        table.tryAcquire(2, "A");
        table.tryAcquire(0, "B");
        table.tryAcquire(0, "C");

        List<ResourceTable.Handoff> handoffs = table.releaseAll("A");

        assertEquals(2, handoffs.size());
        assertEquals(0, handoffs.get(0).resourceId);
        assertEquals("B", handoffs.get(0).newOwner);
        assertEquals(2, handoffs.get(1).resourceId);
        assertNull(handoffs.get(1).newOwner);
        assertEquals("B", table.ownerOf(0));
        assertEquals(List.of("C"), table.waitersOf(0));
        assertNull(table.ownerOf(2));
        assertTrue(table.ownedBy("A").isEmpty());
    }

    @Test
    void releaseAllDropsReleaserFromWaitQueues() {
        ResourceTable table = new ResourceTable(2);
        table.tryAcquire(1, "B");
        table.tryAcquire(1, "A");

        table.releaseAll("A");

        assertTrue(table.waitersOf(1).isEmpty());
        assertEquals("B", table.ownerOf(1));
    }

    @Test
    void forceReleaseGrantsHeadWaiter() {
        ResourceTable table = new ResourceTable(2);
        table.tryAcquire(1, "A");
        table.tryAcquire(1, "B");
        table.tryAcquire(1, "C");

        ResourceTable.Handoff h = table.forceRelease(1);

        assertEquals("A", h.formerOwner);
        assertEquals("B", h.newOwner);
        assertEquals("B", table.ownerOf(1));
        assertEquals(List.of("C"), table.waitersOf(1));
    }

    @Test
    void forceReleaseWithoutWaitersOnlyClearsOwnership() {
        ResourceTable table = new ResourceTable(2);
        table.tryAcquire(0, "A");

        ResourceTable.Handoff h = table.forceRelease(0);

        assertEquals("A", h.formerOwner);
        assertNull(h.newOwner);
        assertNull(table.ownerOf(0));
        assertEquals(ResourceTable.Outcome.GRANTED, table.tryAcquire(0, "B"));
    }

    @Test
    void undeclaredResourceIsRejected() {
        ResourceTable table = new ResourceTable(2);

        assertFalse(table.isDeclared(5));
        SimulationException e = assertThrows(SimulationException.class, () -> table.tryAcquire(5, "A"));
        assertEquals(SimulationException.Kind.UNKNOWN_RESOURCE, e.getKind());
        assertEquals(5, e.getResourceId());
    }
}
