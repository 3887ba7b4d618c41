package app.adlens.media.domain.type;

public enum MediaKind {
    image,
    video
}
