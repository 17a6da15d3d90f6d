package com.httpmonitor.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class CooldownLedger {
    private final ConcurrentMap<Key, Instant> lastDispatch = new ConcurrentHashMap<>();

    /**
     * Records {@code now} and returns true unless a dispatch for the same pair happened less than
     * {@code cooldown} ago.
     */
    public boolean tryAcquire(String ruleName, String targetName, Duration cooldown, Instant now) {
        boolean[] acquired = new boolean[1];
        lastDispatch.compute(new Key(ruleName, targetName), (key, last) -> {
            if (last != null && Duration.between(last, now).compareTo(cooldown) < 0) {
                return last;
            }
            acquired[0] = true;
            return now;
        });
        return acquired[0];
    }

    public Optional<Instant> lastDispatch(String ruleName, String targetName) {
        return Optional.ofNullable(lastDispatch.get(new Key(ruleName, targetName)));
    }

    private static final class Key {
        private final String rule;
        private final String target;

        private Key(String rule, String target) {
            this.rule = rule;
            this.target = target;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key other = (Key) o;
            return rule.equals(other.rule) && target.equals(other.target);
        }

        @Override
        public int hashCode() {
            return Objects.hash(rule, target);
        }
    }
}
