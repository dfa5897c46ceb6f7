package io.github.yok.fixturelink.fixer;

import io.github.yok.fixturelink.config.FixerConfig;
import io.github.yok.fixturelink.core.FixtureRecord;
import io.github.yok.fixturelink.util.BooleanLiterals;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives the {@code groups} membership list of users from their role flags.
 *
 * <ul>
 * <li>{@code is_superuser} true → the superuser group id is a member</li>
 * <li>{@code role} equal to a configured role → that role's group id is a member</li>
 * </ul>
 *
 * <p>
 * Membership is a set union: an id already present (compared numerically) is never added again,
 * and ids already in the list are kept. The field is only written when the list is not empty.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class UserGroupFixer implements FixtureFixer {

    static final String GROUPS = "groups";
    static final String SUPERUSER = "is_superuser";
    static final String ROLE = "role";

    private final FixerConfig.UserGroups config;

    /**
     * Creates the fixer.
     *
     * @param config group settings
     */
    public UserGroupFixer(FixerConfig.UserGroups config) {
        this.config = config;
    }

    @Override
    public String entity() {
        return config.getEntity();
    }

    @Override
    public boolean apply(FixtureRecord record) {
        Map<String, Object> fields = record.getFields();
        List<Object> groups = currentGroups(fields.get(GROUPS));
        boolean changed = false;

        if (BooleanLiterals.isTrue(fields.get(SUPERUSER))) {
            changed |= union(groups, config.getSuperuserGroupId());
        }
        Object role = fields.get(ROLE);
        if (role instanceof String && config.getRoleGroups().containsKey(role)) {
            changed |= union(groups, config.getRoleGroups().get(role));
        }

        if (changed) {
            fields.put(GROUPS, groups);
            log.debug("{} pk={} groups → {}", record.getEntity(), record.getPrimaryKey(), groups);
        }
        return changed;
    }

    private static List<Object> currentGroups(Object value) {
        List<Object> groups = new ArrayList<>();
        if (value instanceof Collection) {
            groups.addAll((Collection<?>) value);
        } else if (value != null) {
            groups.add(value);
        }
        return groups;
    }

    private static boolean union(List<Object> groups, int groupId) {
        for (Object member : groups) {
            if (sameId(member, groupId)) {
                return false;
            }
        }
        groups.add(groupId);
        return true;
    }

    private static boolean sameId(Object member, int groupId) {
        if (member instanceof Number) {
            return ((Number) member).longValue() == groupId;
        }
        return member != null && String.valueOf(groupId).equals(member.toString().trim());
    }
}
