package com.ryuqq.offload.core.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedList;
import java.util.ListIterator;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 재사용 가능하고 크기 조절이 가능한 바이트 버퍼 풀.
 *
 * <p>직렬화나 소켓 I/O처럼 호출마다 버퍼가 필요한 곳에서 힙 할당과 GC 부담을 줄이기 위해 사용합니다.</p>
 *
 * <p><strong>할당 정책 (first-fit):</strong></p>
 * <ol>
 *   <li>용량 오름차순으로 정렬된 free list에서 min_size 이상인 첫 번째 배열을 반환</li>
 *   <li>맞는 배열이 없으면 가장 작은 배열 하나를 제거 (풀의 무한 증가 방지)</li>
 *   <li>정확히 min_size 크기의 새 배열을 할당</li>
 * </ol>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>free list의 스캔, 삽입, 제거는 단일 모니터 안에서 수행</li>
 *   <li>실제 배열 할당({@code new byte[n]})은 락 밖에서 수행</li>
 *   <li>{@link Buffer} 핸들 자체는 스레드 간 공유하지 않음 (소유자는 항상 하나)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (Buffer&lt;Frame&gt; buffer = pool.getBuffer(512, frame)) {
 *     int written = codec.write(frame, buffer.data());
 *     buffer.setSize(written);
 *     channel.send(buffer.data(), buffer.size());
 * } // 배열이 풀로 반환됨
 * </pre>
 *
 * @author Offload Team
 * @since 1.0.0
 */
public final class BufferPool {

    /**
     * resize 시 추가로 확보하는 용량 비율의 하한.
     */
    public static final float MIN_RESIZE_OFFSET = 0.1f;

    private static final Logger log = LoggerFactory.getLogger(BufferPool.class);
    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final LinkedList<byte[]> available = new LinkedList<>();
    private final AtomicLong allocations = new AtomicLong();

    /**
     * 최소 min_size 바이트 용량의 버퍼 조회 (컨텍스트 없음).
     *
     * @param minSize 최소 용량
     * @param <T> 컨텍스트 타입
     * @return 크기 0인 버퍼 (용량은 min_size 이상)
     * @throws IllegalArgumentException minSize가 음수인 경우
     */
    public <T> Buffer<T> getBuffer(int minSize) {
        return getBuffer(minSize, null);
    }

    /**
     * 최소 min_size 바이트 용량의 버퍼 조회.
     *
     * <p>풀에 남은 자원에 따라 실제 용량은 더 클 수 있습니다.</p>
     *
     * @param minSize 최소 용량
     * @param context 버퍼에 연결할 컨텍스트 (null 허용)
     * @param <T> 컨텍스트 타입
     * @return 크기 0인 버퍼 (용량은 min_size 이상)
     * @throws IllegalArgumentException minSize가 음수인 경우
     */
    public <T> Buffer<T> getBuffer(int minSize, T context) {
        return new Buffer<>(this, grab(minSize), 0, context, 0, true);
    }

    /**
     * 외부에서 소유한 배열로 버퍼 생성.
     *
     * <p>이 배열은 풀에서 할당된 것이 아니므로 close 시 free list에 추가되지 않습니다.</p>
     *
     * @param data 외부 배열
     * @param context 버퍼에 연결할 컨텍스트 (null 허용)
     * @param <T> 컨텍스트 타입
     * @return 크기가 data.length인 버퍼
     * @throws IllegalArgumentException data가 null인 경우
     */
    public <T> Buffer<T> getBufferFromExistingData(byte[] data, T context) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        return new Buffer<>(this, data, data.length, context, 0, false);
    }

    /**
     * 버퍼를 최소 min_size 용량으로 resize.
     *
     * <p>반환된 핸들이 새 소유자이며, 용량이 부족했던 경우 기존 핸들은 무효화됩니다.</p>
     *
     * @param buffer resize할 버퍼
     * @param minSize 새 최소 용량
     * @param <T> 컨텍스트 타입
     * @return resize된 버퍼 (용량이 충분했다면 같은 핸들)
     * @throws IllegalArgumentException buffer가 null이거나 minSize가 음수인 경우
     * @see Buffer#resize(int)
     */
    public <T> Buffer<T> resize(Buffer<T> buffer, int minSize) {
        if (buffer == null) {
            throw new IllegalArgumentException("Can not resize undefined buffer");
        }
        return buffer.resize(minSize);
    }

    /**
     * 지금까지 새로 할당한 배열 수 조회.
     *
     * @return 할당 횟수
     */
    public long allocationCount() {
        return allocations.get();
    }

    /**
     * free list에 있는 배열 수 조회.
     *
     * @return 재사용 가능한 배열 수
     */
    public int availableCount() {
        synchronized (available) {
            return available.size();
        }
    }

    /**
     * resize 시 새 용량 계산.
     *
     * <p>자주 resize되는 버퍼는 앞으로의 resize 횟수를 줄이도록 여유를 더 주고,
     * 크기가 거의 일정한 버퍼는 과도하게 할당하지 않습니다:</p>
     * <pre>
     * growth = max(1 - minSize / currentCapacity, 0.1)
     * newCapacity = minSize + resizeCount * growth * minSize
     * </pre>
     *
     * @param currentCapacity 현재 용량
     * @param minSize 요청된 최소 용량
     * @param resizeCount 지금까지의 resize 횟수
     * @return 새 용량 (minSize 이상)
     */
    static int growCapacity(int currentCapacity, int minSize, int resizeCount) {
        float growth = currentCapacity > 0
            ? Math.max(1f - ((float) minSize) / currentCapacity, MIN_RESIZE_OFFSET)
            : MIN_RESIZE_OFFSET;
        long extra = (long) (resizeCount * growth * minSize);
        return (int) Math.min((long) minSize + extra, MAX_CAPACITY);
    }

    byte[] grab(int minSize) {
        if (minSize < 0) {
            throw new IllegalArgumentException("minSize cannot be negative, but was: " + minSize);
        }

        byte[] buffer = null;

        synchronized (available) {
            ListIterator<byte[]> it = available.listIterator();
            while (it.hasNext()) {
                byte[] candidate = it.next();
                if (candidate.length >= minSize) {
                    buffer = candidate;
                    it.remove();
                    break;
                }
            }

            // Nothing fits: evict the smallest entry
            if (buffer == null && !available.isEmpty()) {
                byte[] evicted = available.removeFirst();
                log.debug("Evicted pooled buffer of {} bytes to make room for {} bytes", evicted.length, minSize);
            }
        }

        if (buffer == null) {
            buffer = new byte[minSize];
            allocations.incrementAndGet();
        }

        return buffer;
    }

    void release(byte[] buffer) {
        if (buffer == null) {
            return;
        }

        int size = buffer.length;

        synchronized (available) {
            if (available.isEmpty() || available.getLast().length <= size) {
                available.addLast(buffer);
                return;
            }

            ListIterator<byte[]> it = available.listIterator();
            while (it.hasNext()) {
                if (it.next().length >= size) {
                    it.previous();
                    it.add(buffer);
                    return;
                }
            }
        }
    }
}
