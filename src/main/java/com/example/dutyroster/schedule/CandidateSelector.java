package com.example.dutyroster.schedule;

import com.example.dutyroster.calendar.DutySlot;
import com.example.dutyroster.member.Member;

import java.util.List;

/**
 * Picks one member from a non-empty pool of candidates that passed every hard rule.
 * Implementations must be deterministic for identical input.
 */
public interface CandidateSelector {

    Member select(DutySlot slot, List<Member> pool, FairnessState state);
}
