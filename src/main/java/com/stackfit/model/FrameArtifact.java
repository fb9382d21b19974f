package com.stackfit.model;

import java.nio.file.Path;

/**
 * Ficheros que acompanan a cada frame en el directorio de trabajo, en el orden en que
 * se comprueban antes del ajuste simultaneo.
 */
public enum FrameArtifact {
    IMAGE(".fits", "pixeles"),
    FITTING_OPTIONS(".opt", "opciones de ajuste"),
    DETECTION_OPTIONS(".als.opt", "opciones de deteccion"),
    APERTURE_PHOTOMETRY(".ap", "fotometria de apertura"),
    PSF_MODEL(".psf", "modelo PSF"),
    SOURCE_LIST(".als", "lista de fuentes"),
    LOG(".log", "log de proceso"),
    FITTED_PHOTOMETRY(".alf", "fotometria ajustada"),
    MASK("_mask.fits", "mascara de pixeles malos"),
    WEIGHT_MAP("_wmap.fits", "mapa de pesos");

    /** Los que deben existir antes de lanzar el ajuste simultaneo. */
    public static final FrameArtifact[] FIT_PREREQUISITES = {
            IMAGE, FITTING_OPTIONS, DETECTION_OPTIONS, APERTURE_PHOTOMETRY, PSF_MODEL, SOURCE_LIST, LOG
    };

    private final String suffix;
    private final String description;

    FrameArtifact(String suffix, String description) {
        this.suffix = suffix;
        this.description = description;
    }

    public String suffix() { return suffix; }
    public String description() { return description; }

    public Path in(Path dir, String frameId) {
        return dir.resolve(frameId + suffix);
    }

    public ExpectedArtifact expect(Path dir, String frameId) {
        return new ExpectedArtifact(in(dir, frameId), description + " de " + frameId);
    }
}
