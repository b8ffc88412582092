package com.flagship.token_ledger.ledger;

import com.flagship.token_ledger.ledger.exception.LedgerErrorCode;
import com.flagship.token_ledger.ledger.exception.LedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class StagedBalancesTest {

    private static final Address A = Address.of("0xA");
    private static final Address B = Address.of("0xB");
    private static final Address C = Address.of("0xC");

    private InMemoryBalanceStore store;

    @BeforeEach
    void setUp() {
        store = spy(new InMemoryBalanceStore());
        store.credit(A, 50);
    }

    @Test
    @DisplayName("Staged changes are invisible to the store until commit")
    void testNothingWrittenBeforeCommit() {
        StagedBalances staged = new StagedBalances(store);
        staged.debit(A, 20);
        staged.credit(B, 20);

        assertEquals(30, staged.balanceOf(A));
        assertEquals(20, staged.balanceOf(B));
        assertEquals(50, store.getBalance(A));
        assertEquals(0, store.getBalance(B));

        staged.commit();

        assertEquals(30, store.getBalance(A));
        assertEquals(20, store.getBalance(B));
    }

    @Test
    @DisplayName("Debit beyond the projected balance is rejected")
    void testDebitBeyondProjectedBalance() {
        StagedBalances staged = new StagedBalances(store);
        staged.debit(A, 40);

        LedgerException e = assertThrows(LedgerException.class, () -> staged.debit(A, 20));
        assertEquals(LedgerErrorCode.INSUFFICIENT_BALANCE, e.getCode());
        assertEquals(10, staged.balanceOf(A));
    }

    @Test
    @DisplayName("Repeated changes to one holder are netted into a single store call")
    void testDeltasAreNetted() {
        StagedBalances staged = new StagedBalances(store);
        staged.debit(A, 10);
        staged.debit(A, 10);
        staged.credit(B, 10);
        staged.credit(B, 10);

        staged.commit();

        verify(store).debit(A, 20);
        verify(store).credit(B, 20);
    }

    @Test
    @DisplayName("Commit applies debits before credits")
    void testDebitsBeforeCredits() {
        StagedBalances staged = new StagedBalances(store);
        staged.credit(B, 5);
        staged.debit(A, 5);

        staged.commit();

        InOrder order = inOrder(store);
        order.verify(store).debit(A, 5);
        order.verify(store).credit(B, 5);
    }

    @Test
    @DisplayName("Store failure mid-commit reverses the deltas already applied")
    void testCompensationOnStoreFailure() {
        doThrow(new IllegalStateException("store unavailable")).when(store).credit(eq(C), anyLong());

        StagedBalances staged = new StagedBalances(store);
        staged.debit(A, 30);
        staged.credit(B, 10);
        staged.credit(C, 20);

        IllegalStateException e = assertThrows(IllegalStateException.class, staged::commit);
        assertEquals("store unavailable", e.getMessage());

        assertEquals(50, store.getBalance(A));
        assertEquals(0, store.getBalance(B));
        assertEquals(0, store.getBalance(C));
    }

    @Test
    @DisplayName("A committed unit of work cannot be reused")
    void testCommitIsFinal() {
        StagedBalances staged = new StagedBalances(store);
        staged.credit(B, 1);
        staged.commit();

        assertThrows(IllegalStateException.class, () -> staged.credit(B, 1));
        assertThrows(IllegalStateException.class, staged::commit);
    }

    @Test
    @DisplayName("Discarding without commit leaves the store untouched")
    void testDiscard() {
        StagedBalances staged = new StagedBalances(store);
        staged.debit(A, 50);
        staged.credit(B, 50);

        verify(store, never()).debit(eq(A), anyLong());
        assertEquals(50, store.getBalance(A));
    }
}
