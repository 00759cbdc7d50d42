package cofounder.google.auth.entity;

import lombok.Value;

@Value
public class ScopeDefinition {
    String name;
    String url;
    String description;
    String category;
}
