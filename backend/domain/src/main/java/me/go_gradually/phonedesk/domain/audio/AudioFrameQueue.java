package me.go_gradually.phonedesk.domain.audio;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

// 가득 차면 가장 오래된 프레임부터 버린다.
public final class AudioFrameQueue {
    public static final int DEFAULT_CAPACITY = 400;

    private final int capacity;
    private final Deque<AudioFrame> frames = new ArrayDeque<>();
    private long droppedCount;

    public AudioFrameQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public static AudioFrameQueue withDefaultCapacity() {
        return new AudioFrameQueue(DEFAULT_CAPACITY);
    }

    public int offer(AudioFrame frame) {
        if (frame == null) {
            return 0;
        }
        int dropped = 0;
        while (frames.size() >= capacity) {
            frames.pollFirst();
            dropped++;
        }
        frames.addLast(frame);
        droppedCount += dropped;
        return dropped;
    }

    public List<AudioFrame> drain() {
        List<AudioFrame> drained = new ArrayList<>(frames);
        frames.clear();
        return drained;
    }

    public void clear() {
        frames.clear();
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public long droppedCount() {
        return droppedCount;
    }
}
