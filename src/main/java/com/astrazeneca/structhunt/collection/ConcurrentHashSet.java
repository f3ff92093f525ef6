package com.astrazeneca.structhunt.collection;

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Set view over a ConcurrentHashMap. Iteration is weakly consistent, so the set can be read by one thread
 * while workers add to it.
 * @param <E> element type
 */
public class ConcurrentHashSet<E> extends AbstractSet<E> {
    private final Map<E, Boolean> map = new ConcurrentHashMap<>();

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public boolean contains(Object e) {
        return map.containsKey(e);
    }

    @Override
    public Iterator<E> iterator() {
        return map.keySet().iterator();
    }

    @Override
    public boolean add(E e) {
        return map.put(e, Boolean.TRUE) == null;
    }

    @Override
    public boolean remove(Object o) {
        return map.remove(o) != null;
    }

    @Override
    public void clear() {
        map.clear();
    }
}
