package de.caluga.pipeline;

/**
 * Field name mapping used when nothing else is configured. With camel case conversion enabled,
 * <code>documentId</code> becomes <code>document_id</code>. Dotted paths are converted per segment,
 * numeric array indexes are left alone.
 */
public class DefaultFieldNameMapper implements FieldNameMapper {
    private boolean ccc;

    public DefaultFieldNameMapper(boolean convertCamelCase) {
        this.ccc = convertCamelCase;
    }

    public boolean isConvertCamelCase() {
        return ccc;
    }

    public void enableConvertCamelCase() {
        ccc = true;
    }

    public void disableConvertCamelCase() {
        ccc = false;
    }

    @Override
    public String getMongoFieldName(String javaName) {
        if (!ccc || javaName == null || javaName.isEmpty()) {
            return javaName;
        }

        if (!javaName.contains(".")) {
            return convertCamelCase(javaName);
        }

        StringBuilder b = new StringBuilder();

        for (String segment : javaName.split("\\.")) {
            if (b.length() > 0) {
                b.append(".");
            }

            b.append(convertCamelCase(segment));
        }

        return b.toString();
    }

    /**
     * turns documentId into document_id
     *
     * @param n - string to convert
     * @return converted string (camelCase becomes camel_case)
     */
    public String convertCamelCase(String n) {
        StringBuilder b = new StringBuilder();

        for (int i = 0; i < n.length(); i++) {
            if (Character.isUpperCase(n.charAt(i)) && i > 0) {
                b.append("_");
            }

            b.append(Character.toLowerCase(n.charAt(i)));
        }

        return b.toString();
    }
}
