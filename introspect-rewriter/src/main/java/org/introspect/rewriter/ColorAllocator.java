package org.introspect.rewriter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * First come, first served assignment of palette slots to entities. Once the palette is used up, later
 * entities stay plain.
 */
public final class ColorAllocator {
    private final Palette palette;
    private final Map<EntityIdentity, Color> assigned = new LinkedHashMap<>();
    private int next;

    public ColorAllocator(Palette palette) {
        this.palette = palette;
    }

    public Color lookup(EntityIdentity entity) {
        return assigned.get(entity);
    }

    public Color assign(EntityIdentity entity) {
        if (assigned.containsKey(entity)) {
            return assigned.get(entity);
        }
        Color color = next < palette.size() ? palette.get(next++) : null;
        assigned.put(entity, color);
        return color;
    }

    public List<EntityIdentity> entities() {
        return new ArrayList<>(assigned.keySet());
    }

    public Palette getPalette() {
        return palette;
    }

    public void clear() {
        assigned.clear();
        next = 0;
    }
}
