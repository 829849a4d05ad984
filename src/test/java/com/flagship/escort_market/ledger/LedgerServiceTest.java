package com.flagship.escort_market.ledger;

import com.flagship.escort_market.command.MarketplaceCommandService;
import com.flagship.escort_market.error.InsufficientBalanceException;
import com.flagship.escort_market.support.Fixtures;
import com.flagship.escort_market.support.TestClockConfig;
import com.flagship.escort_market.user.UserEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the ledger: overdrafts, concurrent debits and a tampered balance.
 *
 * The invariant under test: a user's balance always equals the sum of their transactions.
 */
@SpringBootTest
@Import(TestClockConfig.class)
class LedgerServiceTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private MarketplaceCommandService commands;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Fixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new Fixtures(commands);
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private long transactionSum(UUID userId) {
        return ledgerService.getTransactions(userId).stream().mapToLong(LedgerTransaction::getAmount).sum();
    }

    @Test
    @DisplayName("Credit and debit move the balance and append one transaction each")
    void creditAndDebit() {
        printTestHeader("Credit and Debit");
        UserEntity user = fixtures.user("alice");
        UUID reference = UUID.randomUUID();

        ledgerService.credit(user.getId(), 500, TransactionType.ORDER_PAYOUT, reference, "payout");
        ledgerService.debit(user.getId(), 200, TransactionType.WITHDRAWAL_HOLD, reference, "hold");

        long balance = ledgerService.getBalance(user.getId());
        List<LedgerTransaction> transactions = ledgerService.getTransactions(user.getId());
        printOutput("Balance", balance);
        printOutput("Transactions", transactions);

        assertEquals(300, balance);
        assertEquals(2, transactions.size());
        assertTrue(transactions.get(0).isCredit());
        assertEquals(-200, transactions.get(1).getAmount());
        assertEquals(balance, transactionSum(user.getId()));
        printSuccess("Balance equals transaction sum");
    }

    @Test
    @DisplayName("Debit beyond the balance fails and leaves no trace")
    void overdraftRejected() {
        printTestHeader("Overdraft Rejected");
        UserEntity user = fixtures.fundedUser("bob", 100);
        printInput("Balance", 100);
        printInput("Debit", 101);

        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
            () -> ledgerService.debit(user.getId(), 101, TransactionType.MANUAL_DEBIT, null, "too much"));
        printOutput("Exception", e.getMessage());

        assertEquals(100, ledgerService.getBalance(user.getId()));
        assertEquals(1, ledgerService.getTransactions(user.getId()).size());
        printSuccess("Balance untouched");
    }

    @Test
    @DisplayName("Non-positive amounts are invalid input")
    void nonPositiveAmounts() {
        UserEntity user = fixtures.user("carol");
        assertThrows(IllegalArgumentException.class,
            () -> ledgerService.credit(user.getId(), 0, TransactionType.MANUAL_CREDIT, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> ledgerService.debit(user.getId(), -1, TransactionType.MANUAL_DEBIT, null, null));
        assertThrows(IllegalArgumentException.class,
            () -> commands.adjustBalance(user.getId(), 0, null, "nothing"));
    }

    @Test
    @DisplayName("Concurrent debits never overdraw the balance")
    void concurrentDebits() throws Exception {
        printTestHeader("Concurrent Debits");
        UserEntity user = fixtures.fundedUser("dave", 100);
        int threadCount = 10;
        printInput("Balance", 100);
        printInput("Threads", threadCount + " x debit 20");

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    ledgerService.debit(user.getId(), 20, TransactionType.MANUAL_DEBIT, null, "concurrent");
                    succeeded.incrementAndGet();
                } catch (InsufficientBalanceException e) {
                    rejected.incrementAndGet();
                } catch (Exception e) {
                    System.out.println("Unexpected: " + e);
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Succeeded", succeeded.get());
        printOutput("Rejected", rejected.get());
        assertEquals(5, succeeded.get());
        assertEquals(5, rejected.get());
        assertEquals(0, ledgerService.getBalance(user.getId()));
        assertEquals(0, transactionSum(user.getId()));
        printSuccess("Exactly the available balance was debited");
    }

    @Test
    @DisplayName("Adjust and zero balance post manual transactions")
    void adjustAndZero() {
        printTestHeader("Adjust and Zero Balance");
        UserEntity user = fixtures.user("erin");

        commands.adjustBalance(user.getId(), 700, null, "bonus");
        commands.adjustBalance(user.getId(), -200, null, "correction");
        assertEquals(500, ledgerService.getBalance(user.getId()));

        LedgerTransaction zeroed = commands.zeroBalance(user.getId(), null);
        assertEquals(-500, zeroed.getAmount());
        assertEquals(TransactionType.MANUAL_DEBIT, zeroed.getType());
        assertEquals(0, ledgerService.getBalance(user.getId()));

        assertNull(commands.zeroBalance(user.getId(), null), "zeroing an empty balance is a no-op");
        assertEquals(0, transactionSum(user.getId()));
        assertThrows(InsufficientBalanceException.class,
            () -> commands.adjustBalance(user.getId(), -1, null, "overdraft"));
        printSuccess("Manual postings keep the invariant");
    }

    @Test
    @DisplayName("verifyBalances reports a balance that drifted from its transactions")
    void verifyDetectsDrift() {
        printTestHeader("Verify Balances");
        UserEntity user = fixtures.fundedUser("frank", 50);
        assertTrue(ledgerService.verifyBalances().stream().noneMatch(m -> m.getUserId().equals(user.getId())));

        jdbcTemplate.update("UPDATE users SET balance = balance + 5 WHERE id = ?", user.getId());
        try {
            List<BalanceMismatch> mismatches = ledgerService.verifyBalances();
            printOutput("Mismatches", mismatches);

            BalanceMismatch mismatch = mismatches.stream()
                .filter(m -> m.getUserId().equals(user.getId()))
                .findFirst()
                .orElseThrow();
            assertEquals(55, mismatch.getCachedBalance());
            assertEquals(50, mismatch.getTransactionSum());
            printSuccess("Drift detected");
        } finally {
            jdbcTemplate.update("UPDATE users SET balance = balance - 5 WHERE id = ?", user.getId());
        }
    }
}
