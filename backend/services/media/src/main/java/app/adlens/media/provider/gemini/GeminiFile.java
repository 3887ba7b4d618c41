package app.adlens.media.provider.gemini;

public record GeminiFile(String name, String uri, String mimeType, String state) {
    public boolean active() {
        return "ACTIVE".equals(state);
    }

    public boolean failed() {
        return "FAILED".equals(state);
    }

    /**
     * Id part of {@code files/<id>}.
     */
    public String id() {
        return name != null && name.startsWith("files/") ? name.substring("files/".length()) : name;
    }
}
