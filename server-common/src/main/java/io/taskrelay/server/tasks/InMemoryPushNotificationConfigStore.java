package io.taskrelay.server.tasks;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.taskrelay.spec.PushNotificationConfig;
import org.jspecify.annotations.Nullable;

@ApplicationScoped
public class InMemoryPushNotificationConfigStore implements PushNotificationConfigStore {

    private final Map<String, Map<String, PushNotificationConfig>> pushNotificationInfos = new ConcurrentHashMap<>();

    @Override
    public PushNotificationConfig setInfo(String taskId, PushNotificationConfig config) {
        PushNotificationConfig stored = config.id() == null
                ? PushNotificationConfig.builder(config).id(UUID.randomUUID().toString()).build()
                : config;
        pushNotificationInfos.compute(taskId, (id, configs) -> {
            Map<String, PushNotificationConfig> updated = configs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(configs);
            updated.put(stored.id(), stored);
            return updated;
        });
        return stored;
    }

    @Override
    public List<PushNotificationConfig> getInfo(String taskId) {
        Map<String, PushNotificationConfig> configs = pushNotificationInfos.get(taskId);
        return configs == null ? List.of() : new ArrayList<>(configs.values());
    }

    @Override
    public @Nullable PushNotificationConfig getInfo(String taskId, String configId) {
        Map<String, PushNotificationConfig> configs = pushNotificationInfos.get(taskId);
        return configs == null ? null : configs.get(configId);
    }

    @Override
    public void deleteInfo(String taskId, String configId) {
        pushNotificationInfos.computeIfPresent(taskId, (id, configs) -> {
            Map<String, PushNotificationConfig> updated = new LinkedHashMap<>(configs);
            updated.remove(configId);
            return updated.isEmpty() ? null : updated;
        });
    }

    @Override
    public void deleteAll(String taskId) {
        pushNotificationInfos.remove(taskId);
    }
}
