package com.lbg.markets.surveillance.courier.archive;

/**
 * Plain-text instructions sent once after the last part of a split artifact.
 */
public final class ReassemblyInstructions {

    private ReassemblyInstructions() {
    }

    public static String render(String artifactName, int parts, boolean zipped, boolean encrypted) {
        StringBuilder text = new StringBuilder()
                .append("To reassemble the file:\n")
                .append("1. Download all parts (").append(parts).append(" in total)\n")
                .append("2. Use one of the following commands:\n")
                .append("   # Windows\n")
                .append("   copy /b ").append(artifactName).append(".* ").append(artifactName).append('\n')
                .append('\n')
                .append("   # Linux/Mac\n")
                .append("   cat ").append(artifactName).append(".* > ").append(artifactName).append('\n');
        if (zipped) {
            text.append("3. Extract ").append(artifactName).append('\n')
                    .append('\n')
                    .append(encrypted
                            ? "The ZIP file is encrypted. You'll need the password to extract it."
                            : "The ZIP file is not encrypted.");
        } else {
            text.append('\n').append("The file is not encrypted.");
        }
        return text.toString();
    }
}
