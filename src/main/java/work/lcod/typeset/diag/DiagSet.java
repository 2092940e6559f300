package work.lcod.typeset.diag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Insertion-ordered collection of diagnostics. Identical diagnostics are kept once.
 */
public final class DiagSet implements Iterable<Diag> {
    private final Set<Diag> diags = new LinkedHashSet<>();

    public void insert(Diag diag) {
        diags.add(diag);
    }

    public boolean isEmpty() {
        return diags.isEmpty();
    }

    public int size() {
        return diags.size();
    }

    public boolean hasErrors() {
        for (Diag diag : diags) {
            if (diag.level() == Level.ERROR) {
                return true;
            }
        }
        return false;
    }

    public List<Diag> toList() {
        return Collections.unmodifiableList(new ArrayList<>(diags));
    }

    public List<Map<String, Object>> toMaps() {
        var maps = new ArrayList<Map<String, Object>>(diags.size());
        for (Diag diag : diags) {
            maps.add(diag.toMap());
        }
        return maps;
    }

    @Override
    public Iterator<Diag> iterator() {
        return Collections.unmodifiableSet(diags).iterator();
    }
}
