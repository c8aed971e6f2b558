package com.lendingvault.engine.domain.repository;

import com.lendingvault.engine.domain.model.LedgerJournalEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LedgerJournalRepository extends JpaRepository<LedgerJournalEntry, Long> {

    Page<LedgerJournalEntry> findAllByOrderBySequenceDesc(Pageable pageable);

    Page<LedgerJournalEntry> findByAccountOrderBySequenceDesc(String account, Pageable pageable);
}
