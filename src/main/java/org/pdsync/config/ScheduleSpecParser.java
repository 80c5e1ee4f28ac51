package org.pdsync.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.pdsync.ConfigurationException;

/**
 * Parses schedule specifiers given on the command line or in the environment:
 *
 * <pre>
 * id=P123;userGroup=id=S1;userGroup=name=On-call;userGroup=handle=oncall
 * name=Primary rotation;userGroup=handle=oncall-primary
 * </pre>
 */
public final class ScheduleSpecParser {
    static final String ID = "id";
    static final String NAME = "name";
    static final String USER_GROUP = "userGroup";

    private ScheduleSpecParser() {
    }

    public static ConfigSchedule parse(String schedule) {
        Map<String, List<String>> kvs = new LinkedHashMap<>();
        for (String elem : schedule.split(";", -1)) {
            int separator = elem.indexOf('=');
            if (separator < 0) {
                throw new ConfigurationException("missing separator on element \"%s\"".formatted(elem));
            }
            String key = elem.substring(0, separator);
            String value = elem.substring(separator + 1);
            kvs.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }

        String id = singleValue(kvs, ID);
        String name = singleValue(kvs, NAME);
        if (!id.isEmpty() && !name.isEmpty()) {
            throw new ConfigurationException("\"id\" and \"name\" cannot be specified simultaneously");
        }

        List<ConfigUserGroup> userGroups = new ArrayList<>();
        List<String> userGroupSpecs = kvs.remove(USER_GROUP);
        if (userGroupSpecs != null) {
            for (String userGroup : userGroupSpecs) {
                userGroups.add(parseUserGroup(userGroup));
            }
        }

        if (!kvs.isEmpty()) {
            throw new ConfigurationException("unsupported key/value pairs left: %s".formatted(kvs));
        }

        return new ConfigSchedule(
                id.isEmpty() ? null : id,
                name.isEmpty() ? null : name,
                userGroups);
    }

    static ConfigUserGroup parseUserGroup(String userGroup) {
        String[] kv = userGroup.split("=", -1);
        if (kv.length != 2) {
            throw new ConfigurationException(
                    "user group %s does not follow key=value pattern".formatted(userGroup));
        }
        String ugKey = kv[0];
        String ugValue = kv[1];
        return switch (ugKey) {
            case ID -> ConfigUserGroup.ofId(ugValue);
            case NAME -> ConfigUserGroup.ofName(ugValue);
            case "handle" -> ConfigUserGroup.ofHandle(ugValue);
            default -> throw new ConfigurationException(
                    "user group %s has unexpected key \"%s\"".formatted(userGroup, ugKey));
        };
    }

    // Removes the key; returns "" when absent
    private static String singleValue(Map<String, List<String>> kvs, String key) {
        List<String> values = kvs.remove(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        if (values.size() > 1) {
            throw new ConfigurationException("multiple values for key \"%s\" not allowed".formatted(key));
        }
        return values.get(0);
    }
}
