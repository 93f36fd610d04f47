package com.ivamare.architecture.uow;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpringTransactionFlushTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private TransactionStatus status;

    @Test
    void shouldCommitAroundFlush() {
        when(transactionManager.getTransaction(any())).thenReturn(status);
        AtomicBoolean flushed = new AtomicBoolean();

        new SpringTransactionFlush(transactionManager).execute(() -> flushed.set(true));

        assertThat(flushed).isTrue();
        verify(transactionManager).commit(status);
    }

    @Test
    void shouldRollBackWhenFlushFails() {
        when(transactionManager.getTransaction(any())).thenReturn(status);
        SpringTransactionFlush flush = new SpringTransactionFlush(transactionManager);

        assertThatThrownBy(() -> flush.execute(() -> {
            throw new IllegalStateException("write failed");
        })).isInstanceOf(IllegalStateException.class);

        verify(transactionManager).rollback(status);
        verify(transactionManager, never()).commit(any());
    }
}
