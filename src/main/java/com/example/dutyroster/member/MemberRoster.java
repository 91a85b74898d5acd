package com.example.dutyroster.member;

import com.example.dutyroster.calendar.ShiftType;
import com.example.dutyroster.exception.ConfigInconsistencyException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Members of one run, iterated in name order so candidate evaluation never
 * depends on input order.
 */
public final class MemberRoster {

    private final Map<String, Member> byName;

    private MemberRoster(Map<String, Member> byName) {
        this.byName = byName;
    }

    public static MemberRoster of(Collection<Member> members) {
        Map<String, Member> map = new TreeMap<>();
        List<String> duplicates = new ArrayList<>();
        for (Member member : members) {
            if (map.putIfAbsent(member.name(), member) != null) {
                duplicates.add("duplicate member name: " + member.name());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new ConfigInconsistencyException(duplicates);
        }
        return new MemberRoster(map);
    }

    public List<Member> members() {
        return List.copyOf(byName.values());
    }

    public Optional<Member> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public int size() {
        return byName.size();
    }

    public long countActive(IndexGroup group) {
        return byName.values().stream()
                .filter(Member::active)
                .filter(m -> m.groupFor(group.shiftType()).filter(g -> g == group).isPresent())
                .count();
    }

    public List<Member> serving(ShiftType shiftType) {
        return byName.values().stream().filter(m -> m.serves(shiftType)).toList();
    }
}
