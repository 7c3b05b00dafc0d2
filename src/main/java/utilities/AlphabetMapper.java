package utilities;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

// Assigns dense int ids to arbitrary tokens so they can be tiled as a TokenSequence.
public class AlphabetMapper<T> {
    private static final int MISSING = -1;

    int nextId = 0;
    float loadFactor = 0.75f;

    // Primitive map to avoid boxing the ids
    private final Object2IntOpenHashMap<T> wordToId;

    int capacity;

    public AlphabetMapper() {
        this(16);
    }

    public AlphabetMapper(int capacity) {
        this.capacity = Math.max(1, capacity);

        // Pre-size to the expected alphabet size to avoid rehashing.
        this.wordToId = new Object2IntOpenHashMap<>(this.capacity, loadFactor);
        this.wordToId.defaultReturnValue(MISSING);
    }

    public int getSize() {
        return wordToId.size();
    }

    public int getCapacity() {
        return capacity;
    }

    // Insert-on-miss mapping
    public int getId(T item) {
        int id = wordToId.getInt(item);
        if (id == MISSING) {
            id = nextId++;
            wordToId.put(item, id);
        }
        return id;
    }

    // Id of an already-seen token, or -1.
    public int lookup(T item) {
        return wordToId.getInt(item);
    }

    public void clear() {
        wordToId.clear();
        nextId = 0;
    }
}
