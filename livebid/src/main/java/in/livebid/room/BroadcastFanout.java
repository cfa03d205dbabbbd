package in.livebid.room;

import in.livebid.domain.event.OutboundMessage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Subscriber set of one room. Confined to the room's serialization point.
 *
 * Publishing only offers into each subscriber's bounded queue, so a slow subscriber can never
 * delay delivery to the others. Subscribers whose queue overflowed are reported back for eviction.
 */
final class BroadcastFanout {

    private final Map<String, Subscriber> subscribers = new LinkedHashMap<>();

    boolean add(Subscriber subscriber) {
        return subscribers.putIfAbsent(subscriber.id(), subscriber) == null;
    }

    Subscriber get(String handleId) {
        return subscribers.get(handleId);
    }

    boolean contains(String handleId) {
        return subscribers.containsKey(handleId);
    }

    Subscriber remove(String handleId) {
        return subscribers.remove(handleId);
    }

    int size() {
        return subscribers.size();
    }

    /**
     * Queue the message to every subscriber, in attach order.
     *
     * @return subscribers that could not take the message
     */
    List<Subscriber> publish(OutboundMessage message) {
        List<Subscriber> overflowed = null;
        for (Subscriber subscriber : subscribers.values()) {
            if (!subscriber.offer(message)) {
                if (overflowed == null) {
                    overflowed = new ArrayList<>();
                }
                overflowed.add(subscriber);
            }
        }
        return overflowed == null ? List.of() : overflowed;
    }

    /**
     * Remove and return everyone.
     */
    Collection<Subscriber> clear() {
        List<Subscriber> all = new ArrayList<>(subscribers.values());
        subscribers.clear();
        return all;
    }
}
