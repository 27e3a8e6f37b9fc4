package branchshift.base;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * All non-root events of a chain. The index does not own the events, the
 * branch histories do; it exists for membership tests and for picking an
 * event uniformly at random in constant time.
 *
 * @param <E> event type of the model
 */
public class EventIndex<E extends BranchEvent> {

    private final List<E> events = new ArrayList<E>();
    private final Map<E, Integer> slots = new IdentityHashMap<E, Integer>();

    public void insert(E e) {
        if (slots.containsKey(e))
            return;
        slots.put(e, events.size());
        events.add(e);
    }

    /**
     * @throws ModelStateError if e is not in the index
     */
    public void remove(E e) {
        Integer slot = slots.remove(e);
        if (slot == null)
            throw new ModelStateError(ModelStateError.Kind.EVENT_NOT_FOUND, e + " is not in the event index");

        // fill the hole with the last element
        E last = events.remove(events.size() - 1);
        if (last != e) {
            events.set(slot, last);
            slots.put(last, slot);
        }
    }

    public boolean contains(E e) {
        return slots.containsKey(e);
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * Returns each current member with probability 1 / size().
     * @throws ModelStateError if the index is empty
     */
    public E pickUniform(Random rng) {
        int numEvents = events.size();
        if (numEvents == 0)
            throw new ModelStateError(ModelStateError.Kind.EMPTY_INDEX, "Number of events is zero");
        return events.get(rng.nextInt(numEvents));
    }

    /** A snapshot of the members ordered by map position. */
    public List<E> sortedByMapTime() {
        List<E> sorted = new ArrayList<E>(events);
        Collections.sort(sorted, new Comparator<E>() {
            @Override
            public int compare(E a, E b) {
                return Double.compare(a.getMapTime(), b.getMapTime());
            }
        });
        return sorted;
    }
}
