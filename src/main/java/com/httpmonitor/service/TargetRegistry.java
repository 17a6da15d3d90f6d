package com.httpmonitor.service;

import com.httpmonitor.model.Target;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class TargetRegistry {
    private final List<Target> targets;

    public TargetRegistry(List<Target> targets) {
        Set<String> names = new HashSet<>();
        for (Target target : targets) {
            if (!names.add(target.getName())) {
                throw new IllegalStateException("Duplicate target name: " + target.getName());
            }
        }
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
    }

    public static TargetRegistry from(MonitorProperties properties) {
        List<Target> targets = new ArrayList<>();
        for (MonitorProperties.TargetProperties target : properties.getTargets()) {
            targets.add(new Target(
                target.getName(),
                target.getUrl(),
                target.getMethod(),
                target.getHeaders(),
                target.getExpectedStatus(),
                target.getExpectedContent(),
                target.getTimeout() != null ? target.getTimeout() : properties.getDefaultTimeout(),
                target.getInterval() != null ? target.getInterval() : properties.getDefaultInterval()
            ));
        }
        return new TargetRegistry(targets);
    }

    public List<Target> getTargets() {
        return targets;
    }

    public int size() {
        return targets.size();
    }
}
