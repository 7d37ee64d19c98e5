package org.dxworks.codegraph.analyzer;

import java.nio.file.Path;

/**
 * How node ids are derived from a file and a unit name.
 * <p>
 * {@link #STEM} gives {@code <file stem>.<name>}: two files sharing a stem and a unit name
 * produce the same id. {@link #PATH} gives {@code <root-relative path>::<name>}, which is
 * unique per file.
 */
public enum NodeIdStrategy {
    STEM {
        @Override
        public String moduleId(Path file, Path root) {
            return stemOf(file);
        }

        @Override
        public String nodeId(String moduleId, String unitName) {
            return moduleId + "." + unitName;
        }
    },
    PATH {
        @Override
        public String moduleId(Path file, Path root) {
            Path relative = file;
            if (root != null && !file.equals(root) && file.startsWith(root)) {
                relative = root.relativize(file);
            } else if (root != null && file.equals(root) && file.getFileName() != null) {
                relative = file.getFileName();
            }
            return relative.toString().replace('\\', '/');
        }

        @Override
        public String nodeId(String moduleId, String unitName) {
            return moduleId + "::" + unitName;
        }
    };

    public abstract String moduleId(Path file, Path root);

    public abstract String nodeId(String moduleId, String unitName);

    static String stemOf(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return file.toString();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
