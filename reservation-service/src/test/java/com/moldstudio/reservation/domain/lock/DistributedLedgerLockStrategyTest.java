package com.moldstudio.reservation.domain.lock;

import com.moldstudio.common.exception.ServiceUnavailableException;
import com.moldstudio.reservation.domain.model.IncentiveKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DistributedLedgerLockStrategyTest {

    private static final IncentiveKey EARLY = new IncentiveKey("佐藤", LocalDate.of(2025, 10, 27));
    private static final IncentiveKey LATE = new IncentiveKey("鈴木", LocalDate.of(2025, 10, 28));

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock earlyLock;

    @Mock
    private RLock lateLock;

    @InjectMocks
    private DistributedLedgerLockStrategy strategy;

    @Test
    @DisplayName("locks of a move are taken in key order and released after the action")
    void executeLocked_locksInKeyOrder() throws Exception {
        // given
        given(redissonClient.getLock(EARLY.lockName())).willReturn(earlyLock);
        given(redissonClient.getLock(LATE.lockName())).willReturn(lateLock);
        given(earlyLock.tryLock(anyLong(), anyLong(), any())).willReturn(true);
        given(lateLock.tryLock(anyLong(), anyLong(), any())).willReturn(true);
        given(earlyLock.isHeldByCurrentThread()).willReturn(true);
        given(lateLock.isHeldByCurrentThread()).willReturn(true);

        // when: keys passed in reverse order
        String result = strategy.executeLocked(List.of(LATE, EARLY), () -> "done");

        // then
        assertThat(result).isEqualTo("done");
        InOrder order = inOrder(earlyLock, lateLock);
        order.verify(earlyLock).tryLock(anyLong(), anyLong(), any());
        order.verify(lateLock).tryLock(anyLong(), anyLong(), any());
        order.verify(lateLock).unlock();
        order.verify(earlyLock).unlock();
    }

    @Test
    @DisplayName("a lock that cannot be acquired fails with ServiceUnavailableException and releases held locks")
    void executeLocked_lockTimeout() throws Exception {
        // given
        given(redissonClient.getLock(EARLY.lockName())).willReturn(earlyLock);
        given(redissonClient.getLock(LATE.lockName())).willReturn(lateLock);
        given(earlyLock.tryLock(anyLong(), anyLong(), any())).willReturn(true);
        given(lateLock.tryLock(anyLong(), anyLong(), any())).willReturn(false);
        given(earlyLock.isHeldByCurrentThread()).willReturn(true);

        // when / then
        assertThatThrownBy(() -> strategy.executeLocked(List.of(EARLY, LATE), () -> "never"))
                .isInstanceOf(ServiceUnavailableException.class);
        verify(earlyLock).unlock();
        verify(lateLock, never()).unlock();
    }
}
