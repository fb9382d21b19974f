package com.stackfit.service;

import com.stackfit.error.PipelineException;
import com.stackfit.model.CatalogRow;
import com.stackfit.model.StarCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Junta las magnitudes ajustadas de cada frame por id de la lista maestra: una fila por
 * estrella en el orden del maestro. La clasificacion es opcional y los huecos solo se avisan.
 */
public class MagnitudeMerger {

    private static final Logger log = LoggerFactory.getLogger(MagnitudeMerger.class);
    private static final String STAGE = "merge";

    public StarCatalog merge(Path masterList, List<String> frameIds, List<Path> fitted, Path classificationFile) {
        if (frameIds.size() != fitted.size() || fitted.isEmpty()) {
            throw new PipelineException(STAGE, "Se esperaban " + frameIds.size() + " ficheros ajustados y hay "
                    + fitted.size());
        }
        try {
            List<PhotometryFiles.Star> master = PhotometryFiles.readStars(masterList);
            List<String> header = PhotometryFiles.readHeader(fitted.get(0));
            List<Map<Integer, PhotometryFiles.Star>> perFrame = new ArrayList<>();
            for (Path p : fitted) perFrame.add(PhotometryFiles.readStarsById(p));

            int n = fitted.size();
            List<CatalogRow> rows = new ArrayList<>();
            int dropped = 0;
            for (PhotometryFiles.Star m : master) {
                double[] mags = new double[n];
                double[] errs = new double[n];
                double chi = 0, sharp = 0;
                int found = 0, withChi = 0;
                for (int i = 0; i < n; i++) {
                    PhotometryFiles.Star s = perFrame.get(i).get(m.id);
                    if (s == null || !Double.isFinite(s.mag)) {
                        mags[i] = CatalogRow.NO_MAG;
                        errs[i] = CatalogRow.NO_ERR;
                        continue;
                    }
                    found++;
                    mags[i] = s.mag;
                    errs[i] = Double.isFinite(s.err) ? s.err : CatalogRow.NO_ERR;
                    if (Double.isFinite(s.chi) && Double.isFinite(s.sharp)) {
                        chi += s.chi;
                        sharp += s.sharp;
                        withChi++;
                    }
                }
                if (found == 0) {
                    dropped++;
                    continue;
                }
                rows.add(new CatalogRow(m.id, m.x, m.y, mags, errs,
                        withChi > 0 ? chi / withChi : 9.999, withChi > 0 ? sharp / withChi : 9.999, null, null));
            }
            if (dropped > 0) log.info("{} estrellas del maestro sin ajuste en ningun frame", dropped);

            boolean classified = false;
            int unmatched = 0;
            if (classificationFile != null) {
                if (Files.isRegularFile(classificationFile)) {
                    classified = true;
                    Map<Integer, PhotometryFiles.Classification> cls =
                            PhotometryFiles.readClassifications(classificationFile);
                    List<CatalogRow> joined = new ArrayList<>();
                    for (CatalogRow r : rows) {
                        PhotometryFiles.Classification c = cls.get(r.id);
                        if (c == null) {
                            unmatched++;
                            joined.add(r);
                        } else {
                            joined.add(r.withClassification(c.flag, c.probability));
                        }
                    }
                    rows = joined;
                    if (unmatched > 0) {
                        log.warn("{} de {} estrellas sin clasificacion en {}", unmatched, rows.size(),
                                classificationFile.getFileName());
                    }
                } else {
                    log.warn("No existe el fichero de clasificacion {}; se omite", classificationFile);
                }
            }
            log.info("Catalogo combinado: {} estrellas, {} frames", rows.size(), n);
            return new StarCatalog(header, frameIds, rows, classified, unmatched);
        } catch (IOException e) {
            throw new PipelineException(STAGE, "No se pudo leer la fotometria: " + e.getMessage(), e);
        } catch (NumberFormatException e) {
            throw new PipelineException(STAGE, "Fila con columna no numerica: " + e.getMessage(), e);
        }
    }

    public void write(StarCatalog catalog, Path file) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (String h : catalog.header()) {
                w.write(h);
                w.newLine();
            }
            for (CatalogRow r : catalog.rows()) {
                w.write(format(r, catalog.isClassified()));
                w.newLine();
            }
        }
    }

    static String format(CatalogRow r, boolean classified) {
        StringBuilder sb = new StringBuilder(String.format(Locale.US, "%6d %9.3f %9.3f", r.id, r.x, r.y));
        for (int i = 0; i < r.mags.length; i++) {
            sb.append(String.format(Locale.US, " %9.4f %8.4f", r.mags[i], r.errors[i]));
        }
        sb.append(String.format(Locale.US, " %8.3f %8.3f", r.chi, r.sharp));
        if (classified) {
            int flag = r.classFlag == null ? 0 : r.classFlag;
            double prob = r.classProbability == null ? 0.0 : r.classProbability;
            sb.append(String.format(Locale.US, " %3d %6.3f", flag, prob));
        }
        return sb.toString();
    }
}
