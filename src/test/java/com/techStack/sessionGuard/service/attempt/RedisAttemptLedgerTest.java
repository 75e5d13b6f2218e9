package com.techStack.sessionGuard.service.attempt;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.techStack.sessionGuard.config.LoginSecurityProperties;
import com.techStack.sessionGuard.config.StoreProperties;
import com.techStack.sessionGuard.models.attempt.AttemptOutcome;
import com.techStack.sessionGuard.models.attempt.LoginAttempt;
import com.techStack.sessionGuard.models.security.SubjectType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveZSetOperations;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisAttemptLedgerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final String USER = "alice@example.com";
    private static final String IP = "203.0.113.7";

    @Mock
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Mock
    private ReactiveZSetOperations<String, String> zSetOperations;

    private ObjectMapper objectMapper;
    private LoginSecurityProperties properties;
    private RedisAttemptLedger ledger;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        properties = new LoginSecurityProperties();
        when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        ledger = new RedisAttemptLedger(redisTemplate, objectMapper, properties, new StoreProperties());
    }

    /* =========================
       Writes
       ========================= */

    @Test
    @SuppressWarnings("unchecked")
    void record_appendsToIdentifierAndIpLedgersByScript() throws Exception {
        when(redisTemplate.execute(eq(RedisAttemptLedger.APPEND_SCRIPT), anyList(), anyList()))
                .thenReturn(Flux.just(1L));

        StepVerifier.create(ledger.record(attempt(AttemptOutcome.INVALID_CREDENTIALS, NOW)))
                .verifyComplete();

        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List<Object>> args = ArgumentCaptor.forClass(List.class);
        verify(redisTemplate, times(2)).execute(eq(RedisAttemptLedger.APPEND_SCRIPT), keys.capture(), args.capture());

        assertThat(keys.getAllValues()).containsExactlyInAnyOrder(
                List.of("login_attempts:" + USER), List.of("ip_attempts:" + IP));
        List<Object> first = args.getAllValues().get(0);
        assertThat(first.get(0)).isEqualTo(String.valueOf(NOW.toEpochMilli()));
        assertThat(first.get(2)).isEqualTo(String.valueOf(Duration.ofHours(1).toMillis()));

        LoginAttempt stored = objectMapper.readValue((String) first.get(1), LoginAttempt.class);
        assertThat(stored.getOutcome()).isEqualTo(AttemptOutcome.INVALID_CREDENTIALS);
        assertThat(stored.getNonce()).isNotBlank();
        assertThat(args.getAllValues().get(1).get(1)).isEqualTo(first.get(1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void record_sameMillisecondAttempts_getDistinctMembers() {
        when(redisTemplate.execute(eq(RedisAttemptLedger.APPEND_SCRIPT), anyList(), anyList()))
                .thenReturn(Flux.just(1L));

        ledger.record(attempt(AttemptOutcome.INVALID_CREDENTIALS, NOW)).block();
        ledger.record(attempt(AttemptOutcome.INVALID_CREDENTIALS, NOW)).block();

        ArgumentCaptor<List<Object>> args = ArgumentCaptor.forClass(List.class);
        verify(redisTemplate, times(4)).execute(eq(RedisAttemptLedger.APPEND_SCRIPT), anyList(), args.capture());
        assertThat(args.getAllValues().get(0).get(1)).isNotEqualTo(args.getAllValues().get(2).get(1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void clear_dropsIdentifierKeyAndItsIpEntries() {
        when(redisTemplate.delete("login_attempts:" + USER)).thenReturn(Mono.just(1L));
        when(redisTemplate.execute(eq(RedisAttemptLedger.REMOVE_IDENTIFIER_SCRIPT), anyList(), anyList()))
                .thenReturn(Flux.just(3L));

        StepVerifier.create(ledger.clear(USER, IP)).verifyComplete();

        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<List<Object>> args = ArgumentCaptor.forClass(List.class);
        verify(redisTemplate).execute(eq(RedisAttemptLedger.REMOVE_IDENTIFIER_SCRIPT), keys.capture(), args.capture());
        assertThat(keys.getValue()).containsExactly("ip_attempts:" + IP);
        assertThat(args.getValue()).containsExactly(USER);
    }

    /* =========================
       Reads
       ========================= */

    @Test
    @SuppressWarnings("unchecked")
    void countSince_readsFromWindowStartInclusiveAndCountsFailuresOnly() throws Exception {
        Instant windowStart = NOW.minus(Duration.ofMinutes(15));
        when(zSetOperations.rangeByScore(eq("login_attempts:" + USER), any(Range.class)))
                .thenReturn(Flux.just(
                        json(attempt(AttemptOutcome.INVALID_CREDENTIALS, windowStart)),
                        json(attempt(AttemptOutcome.SUCCESS, NOW.minusSeconds(60))),
                        json(attempt(AttemptOutcome.SYSTEM_ERROR, NOW))));
        when(zSetOperations.rangeByScore(eq("ip_attempts:" + IP), any(Range.class)))
                .thenReturn(Flux.just(json(attempt(AttemptOutcome.INVALID_CREDENTIALS, NOW))));

        StepVerifier.create(ledger.countSince(USER, IP, windowStart))
                .assertNext(counts -> {
                    assertThat(counts.getIdentifierFailures()).isEqualTo(2);
                    assertThat(counts.getIpFailures()).isEqualTo(1);
                })
                .verifyComplete();

        ArgumentCaptor<Range<Double>> range = ArgumentCaptor.forClass(Range.class);
        verify(zSetOperations).rangeByScore(eq("login_attempts:" + USER), range.capture());
        assertThat(range.getValue().getLowerBound().isInclusive()).isTrue();
        assertThat(range.getValue().getLowerBound().getValue()).contains((double) windowStart.toEpochMilli());
        assertThat(range.getValue().getUpperBound().isBounded()).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void recentAttempts_skipsUnreadableEntries() throws Exception {
        when(zSetOperations.rangeByScore(eq("ip_attempts:" + IP), any(Range.class)))
                .thenReturn(Flux.just("{broken", json(attempt(AttemptOutcome.INVALID_CREDENTIALS, NOW))));

        StepVerifier.create(ledger.recentAttempts(SubjectType.IP, IP, NOW.minus(Duration.ofHours(1))))
                .assertNext(attempt -> assertThat(attempt.getIdentifier()).isEqualTo(USER))
                .verifyComplete();
    }

    /* =========================
       Maintenance
       ========================= */

    @Test
    @SuppressWarnings("unchecked")
    void purgeBefore_trimsEveryLedgerKeyBelowTheCutoff() {
        Instant cutoff = NOW.minus(Duration.ofHours(1));
        when(redisTemplate.scan(any(ScanOptions.class)))
                .thenReturn(Flux.just("login_attempts:" + USER), Flux.just("ip_attempts:" + IP));
        when(zSetOperations.removeRangeByScore(eq("login_attempts:" + USER), any(Range.class)))
                .thenReturn(Mono.just(2L));
        when(zSetOperations.removeRangeByScore(eq("ip_attempts:" + IP), any(Range.class)))
                .thenReturn(Mono.just(3L));

        StepVerifier.create(ledger.purgeBefore(cutoff))
                .expectNext(5L)
                .verifyComplete();

        ArgumentCaptor<Range<Double>> range = ArgumentCaptor.forClass(Range.class);
        verify(zSetOperations).removeRangeByScore(eq("login_attempts:" + USER), range.capture());
        assertThat(range.getValue().getLowerBound().isBounded()).isFalse();
        assertThat(range.getValue().getUpperBound().isInclusive()).isFalse();
        assertThat(range.getValue().getUpperBound().getValue()).contains((double) cutoff.toEpochMilli());
    }

    @Test
    void purgeBefore_stalledScan_timesOut() {
        StoreProperties storeProperties = new StoreProperties();
        storeProperties.setTimeout(Duration.ofMillis(50));
        RedisAttemptLedger shortTimeout = new RedisAttemptLedger(redisTemplate, objectMapper, properties, storeProperties);
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(Flux.never());

        StepVerifier.create(shortTimeout.purgeBefore(NOW))
                .expectError(TimeoutException.class)
                .verify(Duration.ofSeconds(5));
    }

    /* =========================
       Helpers
       ========================= */

    private String json(LoginAttempt attempt) throws Exception {
        return objectMapper.writeValueAsString(attempt);
    }

    private static LoginAttempt attempt(AttemptOutcome outcome, Instant timestamp) {
        return LoginAttempt.builder()
                .identifier(USER)
                .ip(IP)
                .userAgent("Mozilla/5.0")
                .deviceFingerprint("fp-1")
                .outcome(outcome)
                .timestamp(timestamp)
                .build();
    }
}
