package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.ledger.BalanceSide;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of a journal entry. Exactly one of debit and credit is non-zero.
 */
@Value
public class JournalLine {
    int lineNumber;
    String accountCode;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    String description;

    public static JournalLine debit(String accountCode, BigDecimal amount, String description) {
        return new JournalLine(0, accountCode, amount, BigDecimal.ZERO, description);
    }

    public static JournalLine credit(String accountCode, BigDecimal amount, String description) {
        return new JournalLine(0, accountCode, BigDecimal.ZERO, amount, description);
    }

    JournalLine numbered(int number) {
        return new JournalLine(number, accountCode, debitAmount, creditAmount, description);
    }

    /**
     * The same line with debit and credit exchanged, used to build a reversing entry.
     */
    JournalLine swapped() {
        return new JournalLine(lineNumber, accountCode, creditAmount, debitAmount, description);
    }

    public BalanceSide side() {
        return debitAmount.signum() > 0 ? BalanceSide.DEBIT : BalanceSide.CREDIT;
    }

    public BigDecimal amount() {
        return side() == BalanceSide.DEBIT ? debitAmount : creditAmount;
    }
}
