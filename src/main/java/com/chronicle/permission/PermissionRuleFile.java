package com.chronicle.permission;

import java.util.List;

public class PermissionRuleFile {
    private String name;
    private String description;
    private String version;
    private List<PermissionRuleItem> rules;

    public PermissionRuleFile() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public List<PermissionRuleItem> getRules() { return rules; }
    public void setRules(List<PermissionRuleItem> rules) { this.rules = rules; }
}
