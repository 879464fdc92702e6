package com.ryuqq.pbxwriter.core.id;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * PBX 객체 식별자 발급 레지스트리.
 *
 * <p>두 개의 독립된 식별자 공간을 관리합니다:</p>
 * <ul>
 *   <li><strong>Content-addressed:</strong> hashing key의 SHA-256 다이제스트 앞 12바이트를
 *       24자리 소문자 hex로 표현하고 prefix를 붙인 값 (최대 24자로 절단).
 *       {@code prefix + "-" + key} 단위로 캐시되어 같은 실행 내에서 항상 같은 값을 반환합니다.</li>
 *   <li><strong>Sequence-addressed:</strong> 0부터 시작하는 전역 카운터를 1씩 증가시켜
 *       22자리 zero-padding 후 {@link #SEQUENCE_PREFIX}를 붙인 24자 고정 길이 값.</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>캐시와 카운터는 단일 {@link ReentrantLock}으로 보호</li>
 *   <li>캐시 hit 조회도 lock 획득 (lock-free fast path 없음)</li>
 *   <li>{@link #resetSequence()}도 같은 lock 사용</li>
 * </ul>
 *
 * <p><strong>제약:</strong> 절단된 hash 식별자끼리의 충돌은 검출하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ObjectIdRegistry registry = ObjectIdRegistry.shared();
 *
 * String fileId = registry.idFor("src/main.c");  // content-addressed ("02...")
 * String tempId = registry.idFor("");            // sequence-addressed ("01...")
 *
 * registry.resetSequence();                       // 다음 실행 준비 (content 캐시는 유지)
 * </pre>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public final class ObjectIdRegistry {

    private static final Logger log = LoggerFactory.getLogger(ObjectIdRegistry.class);

    /**
     * 식별자 최대 길이.
     */
    public static final int MAX_ID_LENGTH = 24;

    /**
     * Sequence-addressed 식별자 prefix.
     */
    public static final String SEQUENCE_PREFIX = "01";

    /**
     * 객체 생성 시 사용하는 content-addressed 식별자 prefix.
     */
    public static final String CONTENT_PREFIX = "02";

    private static final int DIGEST_BYTES = 12;
    private static final int SEQUENCE_DIGITS = MAX_ID_LENGTH - SEQUENCE_PREFIX.length();
    private static final HexFormat HEX = HexFormat.of();

    private static final ObjectIdRegistry SHARED = new ObjectIdRegistry();

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Lookup key ({@code prefix + "-" + hashingKey}) → 발급된 식별자.
     */
    private final Map<String, String> cache = new HashMap<>();

    private long sequence;

    /**
     * 독립된 레지스트리 생성.
     *
     * <p>테스트나 동시에 진행되는 별도 생성 작업은 각자 인스턴스를 사용할 수 있습니다.</p>
     */
    public ObjectIdRegistry() {
    }

    /**
     * 프로세스 전역 공유 레지스트리.
     *
     * @return 공유 인스턴스
     */
    public static ObjectIdRegistry shared() {
        return SHARED;
    }

    /**
     * hashing key에 맞는 식별자 발급.
     *
     * <p>빈 key는 sequence 경로, 그 외에는 {@link #CONTENT_PREFIX}를 사용한 content 경로로 발급합니다.</p>
     *
     * @param hashingKey 내용 기반 key (null 또는 빈 문자열이면 sequence 사용)
     * @return 식별자
     */
    public String idFor(String hashingKey) {
        if (hashingKey == null || hashingKey.isEmpty()) {
            return nextSequenceId();
        }
        return contentId(CONTENT_PREFIX, hashingKey);
    }

    /**
     * Content-addressed 식별자 조회 또는 계산.
     *
     * @param prefix 식별자 prefix
     * @param hashingKey 내용 기반 key
     * @return 캐시된 (또는 새로 계산된) 식별자
     * @throws IllegalArgumentException prefix 또는 hashingKey가 null인 경우
     */
    public String contentId(String prefix, String hashingKey) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        if (hashingKey == null) {
            throw new IllegalArgumentException("hashingKey cannot be null");
        }

        String lookupKey = prefix + "-" + hashingKey;
        lock.lock();
        try {
            String cached = cache.get(lookupKey);
            if (cached != null) {
                return cached;
            }

            String id = prefix + HEX.formatHex(sha256(hashingKey), 0, DIGEST_BYTES);
            if (id.length() > MAX_ID_LENGTH) {
                id = id.substring(0, MAX_ID_LENGTH);
            }
            cache.put(lookupKey, id);
            log.debug("Assigned content id {} for key '{}'", id, lookupKey);
            return id;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 다음 sequence-addressed 식별자 발급.
     *
     * @return {@code "01"} + 22자리 zero-padded 카운터 값
     */
    public String nextSequenceId() {
        lock.lock();
        try {
            sequence += 1;
            return SEQUENCE_PREFIX + String.format(Locale.ROOT, "%0" + SEQUENCE_DIGITS + "d", sequence);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sequence 카운터를 0으로 되돌림.
     *
     * <p>Content 캐시는 건드리지 않습니다. 연속 호출해도 결과는 같습니다.</p>
     */
    public void resetSequence() {
        lock.lock();
        try {
            sequence = 0;
        } finally {
            lock.unlock();
        }
        log.debug("Object id sequence reset");
    }

    /**
     * 캐시된 content 식별자 수.
     *
     * @return 캐시 항목 수
     */
    public int cachedIdCount() {
        lock.lock();
        try {
            return cache.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 식별자 정규화: 구분자({@code -}) 제거 후 최대 24자로 절단.
     *
     * @param id 원본 식별자
     * @return 정규화된 식별자
     */
    public static String normalize(String id) {
        String stripped = id.replace("-", "");
        if (stripped.length() > MAX_ID_LENGTH) {
            return stripped.substring(0, MAX_ID_LENGTH);
        }
        return stripped;
    }

    private static byte[] sha256(String hashingKey) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(hashingKey.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 digest not available", e);
        }
    }
}
