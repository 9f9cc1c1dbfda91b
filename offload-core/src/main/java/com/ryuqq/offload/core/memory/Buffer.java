package com.ryuqq.offload.core.memory;

import com.ryuqq.offload.core.exception.DisposedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * {@link BufferPool}에서 받은 바이트 버퍼 핸들.
 *
 * <p><strong>소유권:</strong></p>
 * <ul>
 *   <li>배열을 소유하는 살아있는 핸들은 항상 하나</li>
 *   <li>{@link #resize(int)}, {@link #mutate(Object)}는 소유권을 새 핸들로 옮기고 기존 핸들을 무효화</li>
 *   <li>무효화된 핸들에 접근하면 {@link DisposedException}</li>
 *   <li>{@link #close()}는 멱등하며, 무효화된 핸들에서는 아무 일도 하지 않음</li>
 * </ul>
 *
 * <p><strong>반환 정책:</strong></p>
 * <ul>
 *   <li>풀에서 할당된 배열: close 시 free list로 반환</li>
 *   <li>외부 배열 ({@link BufferPool#getBufferFromExistingData}): 반환하지 않음</li>
 *   <li>resize로 대체된 배열: 반환하지 않음</li>
 *   <li>컨텍스트가 {@link AutoCloseable}이면 close 시 함께 닫음</li>
 * </ul>
 *
 * <p>핸들은 thread-safe하지 않습니다. 다른 스레드로 넘길 때는 소유권을 통째로 넘깁니다.</p>
 *
 * @param <T> 컨텍스트 타입
 * @author Offload Team
 * @since 1.0.0
 */
public final class Buffer<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Buffer.class);

    private enum Ownership { LIVE, SUPERSEDED, RELEASED }

    private final BufferPool pool;
    private final boolean pooled;

    private byte[] data;
    private int size;
    private T context;
    private int resizeCount;
    private Ownership ownership = Ownership.LIVE;

    Buffer(BufferPool pool, byte[] data, int size, T context, int resizeCount, boolean pooled) {
        this.pool = pool;
        this.data = data;
        this.size = size;
        this.context = context;
        this.resizeCount = resizeCount;
        this.pooled = pooled;
    }

    /**
     * 버퍼 바이트 배열 조회.
     *
     * @return 배열 (길이 = capacity)
     * @throws DisposedException 무효화된 핸들인 경우
     */
    public byte[] data() {
        checkLive();
        return data;
    }

    /**
     * 버퍼 용량 조회.
     *
     * @return 배열 길이
     * @throws DisposedException 무효화된 핸들인 경우
     */
    public int capacity() {
        checkLive();
        return data.length;
    }

    /**
     * 사용 중인 크기 조회.
     *
     * @return 논리적 크기 (capacity 이하)
     * @throws DisposedException 무효화된 핸들인 경우
     */
    public int size() {
        checkLive();
        return size;
    }

    /**
     * 사용 중인 크기 설정.
     *
     * @param size 새 논리적 크기
     * @throws IllegalArgumentException size가 음수이거나 capacity를 넘는 경우
     * @throws DisposedException 무효화된 핸들인 경우
     */
    public void setSize(int size) {
        checkLive();
        if (size < 0 || size > data.length) {
            throw new IllegalArgumentException(
                "size must be between 0 and capacity " + data.length + " (current: " + size + ")"
            );
        }
        this.size = size;
    }

    /**
     * 연결된 컨텍스트 조회.
     *
     * @return 컨텍스트 (null 가능)
     * @throws DisposedException 무효화된 핸들인 경우
     */
    public T context() {
        checkLive();
        return context;
    }

    /**
     * 지금까지의 resize 횟수 조회.
     *
     * @return resize 횟수
     * @throws DisposedException 무효화된 핸들인 경우
     */
    public int resizeCount() {
        checkLive();
        return resizeCount;
    }

    /**
     * 배열이 풀에서 할당되었는지 확인.
     *
     * @return 외부 배열이면 false
     */
    public boolean isPooled() {
        return pooled;
    }

    /**
     * 핸들이 아직 배열을 소유하는지 확인.
     *
     * @return 살아있는 핸들이면 true
     */
    public boolean isLive() {
        return ownership == Ownership.LIVE;
    }

    /**
     * 최소 min_size 용량으로 resize.
     *
     * <p>용량이 충분하면 아무것도 하지 않고 이 핸들을 그대로 반환합니다.
     * 그렇지 않으면 {@link BufferPool#growCapacity}로 새 용량을 계산해 풀에서 새 배열을 받고,
     * 기존 내용과 크기를 복사한 뒤 기존 배열은 풀에 반환하지 않고 버립니다.</p>
     *
     * @param minSize 새 최소 용량
     * @return 새 소유 핸들 (용량이 충분했다면 this)
     * @throws IllegalArgumentException minSize가 음수인 경우
     * @throws DisposedException 무효화된 핸들인 경우
     */
    public Buffer<T> resize(int minSize) {
        checkLive();
        if (minSize < 0) {
            throw new IllegalArgumentException("minSize cannot be negative, but was: " + minSize);
        }

        if (data.length >= minSize) {
            return this;
        }

        int newCapacity = BufferPool.growCapacity(data.length, minSize, resizeCount);
        byte[] grown = pool.grab(newCapacity);
        System.arraycopy(data, 0, grown, 0, data.length);

        Buffer<T> resized = new Buffer<>(pool, grown, size, context, resizeCount + 1, true);

        // The replaced array is never returned to the pool
        supersede();

        return resized;
    }

    /**
     * 같은 배열에 다른 컨텍스트를 가진 핸들로 소유권 이전.
     *
     * <p>복사도 풀 접근도 없습니다. 기존 컨텍스트는 닫지 않습니다.</p>
     *
     * @param newContext 새 컨텍스트
     * @param <U> 새 컨텍스트 타입
     * @return 새 소유 핸들
     * @throws DisposedException 무효화된 핸들인 경우
     */
    public <U> Buffer<U> mutate(U newContext) {
        checkLive();
        Buffer<U> result = new Buffer<>(pool, data, size, newContext, resizeCount, pooled);
        supersede();
        return result;
    }

    /**
     * 기존 컨텍스트를 변환해 새 핸들로 소유권 이전.
     *
     * @param converter 기존 컨텍스트 → 새 컨텍스트 (null이면 새 컨텍스트는 null)
     * @param <U> 새 컨텍스트 타입
     * @return 새 소유 핸들
     * @throws DisposedException 무효화된 핸들인 경우
     */
    public <U> Buffer<U> mutateWith(Function<? super T, ? extends U> converter) {
        checkLive();
        U converted = converter != null ? converter.apply(context) : null;
        return mutate(converted);
    }

    /**
     * 버퍼 해제. 풀에서 할당된 배열은 free list로 반환됩니다.
     *
     * <p>무효화되었거나 이미 해제된 핸들에서는 아무 일도 하지 않습니다.</p>
     */
    @Override
    public void close() {
        if (ownership != Ownership.LIVE) {
            return;
        }

        ownership = Ownership.RELEASED;

        if (pooled) {
            pool.release(data);
        }

        if (context instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close buffer context {}", context, e);
            }
        }

        clear();
    }

    @Override
    public String toString() {
        if (ownership != Ownership.LIVE) {
            return "Buffer{" + ownership + "}";
        }
        return "Buffer{capacity=" + data.length + ", size=" + size + ", resizeCount=" + resizeCount
            + ", pooled=" + pooled + "}";
    }

    private void supersede() {
        ownership = Ownership.SUPERSEDED;
        clear();
    }

    private void clear() {
        data = null;
        context = null;
        size = 0;
        resizeCount = 0;
    }

    private void checkLive() {
        if (ownership != Ownership.LIVE) {
            throw new DisposedException("Buffer", "Buffer handle is " + ownership.name().toLowerCase()
                + " and can no longer be used");
        }
    }
}
