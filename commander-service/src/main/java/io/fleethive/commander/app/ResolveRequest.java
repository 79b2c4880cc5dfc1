package io.fleethive.commander.app;

import java.util.Map;

public record ResolveRequest(Map<String, String> identifyingAttributes) {
}
