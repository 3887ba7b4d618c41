package app.adlens.media.provider.gemini;

final class AdAnalysisPrompts {
    static final String IMAGE = """
            Analyze this advertisement image. Respond with a single JSON object with these keys:
            "colors": {"dominant_colors": [color names]},
            "people_description": description of any people shown, or an empty string,
            "text_elements": {"headline": [...], "body": [...], "call_to_action": [...]},
            "brand_elements": short description of logos and branding,
            "composition": short description of layout and visual hierarchy.
            """;

    static final String VIDEO = """
            Analyze this advertisement video. Describe the hook in the first seconds, the scenes, \
            people, on-screen text, audio and voice-over, branding, and the call to action.
            """;

    private AdAnalysisPrompts() {
    }

    static String videoBatch(int count) {
        StringBuilder sb = new StringBuilder();
        sb.append("Analyze the following ").append(count).append(" advertisement videos, in the order given. ")
                .append("For each video provide this analysis:\n\n")
                .append(VIDEO)
                .append("\nStart each analysis with its label: \"VIDEO 1:\", \"VIDEO 2:\", etc.\n");
        return sb.toString();
    }
}
