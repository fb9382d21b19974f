package com.stackfit.model;

import com.stackfit.error.ConfigurationException;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Configuracion de una ejecucion. Se construye una vez y se inyecta en cada
 * componente; no hay estado global.
 */
public class PipelineConfig {

    private static final String STAGE = "config";

    // Directorios y motores
    public static final String KEY_WORK_DIR = "work.dir";
    public static final String KEY_SCRIPT_DIR = "script.dir";
    public static final String KEY_ENGINE_DETECT = "engine.detect";
    public static final String KEY_ENGINE_FIT = "engine.fit";
    public static final String KEY_ENGINE_SHELL = "engine.shell";
    public static final String KEY_ENGINE_TIMEOUT = "engine.timeout.seconds";
    public static final String KEY_ENGINE_ENV_PREFIX = "engine.env.";

    // Entradas y salidas
    public static final String KEY_TRANSFORM_FILE = "transform.file";
    public static final String KEY_STACK_NAME = "stack.name";
    public static final String KEY_CATALOG_NAME = "catalog.name";
    public static final String KEY_COMMON_LIST = "common.list";
    public static final String KEY_CLASSIFICATION_FILE = "classification.file";

    // Detector
    public static final String KEY_SATURATION = "saturation.level";
    public static final String KEY_DEFAULT_GAIN = "default.gain";
    public static final String KEY_DEFAULT_RDNOISE = "default.rdnoise";

    // Combinacion
    public static final String KEY_SCALE_FRAMES = "scale.frames";
    public static final String KEY_SUBTRACT_SKY = "subtract.sky";
    public static final String KEY_TRIM = "trim";
    public static final String KEY_CLIP_LOW = "clip.low.sigma";
    public static final String KEY_CLIP_HIGH = "clip.high.sigma";
    public static final String KEY_CLIP_ITERATIONS = "clip.iterations";
    public static final String KEY_WORKERS = "workers";

    // Deteccion / PSF
    public static final String KEY_PSF_ORDER = "psf.order";
    public static final String KEY_ANALYTIC_MODEL = "analytic.model";
    public static final String KEY_FIT_RADIUS = "fit.radius";
    public static final String KEY_FIND_ITERATIONS = "find.iterations";
    public static final String KEY_DETECT_THRESHOLD = "detect.threshold";

    public static final int MIN_FIND_ITERATIONS = 1;
    public static final int MAX_FIND_ITERATIONS = 10;

    private final Properties props;

    public PipelineConfig(Properties props) {
        this.props = new Properties();
        this.props.putAll(props);
    }

    public static PipelineConfig load(Path file) {
        Properties p = new Properties();
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            p.load(r);
        } catch (IOException e) {
            throw new ConfigurationException(STAGE, "No se pudo leer la configuracion " + file, e);
        }
        return new PipelineConfig(p);
    }

    // --- DIRECTORIOS Y MOTORES ---
    public Path getWorkDir() { return Paths.get(props.getProperty(KEY_WORK_DIR, ".")); }

    public Path getScriptDir() {
        String v = props.getProperty(KEY_SCRIPT_DIR);
        return v == null ? null : Paths.get(v);
    }

    public Path getDetectEngine() { return resolveEngine(KEY_ENGINE_DETECT); }
    public Path getFitEngine() { return resolveEngine(KEY_ENGINE_FIT); }

    public String getShell() { return props.getProperty(KEY_ENGINE_SHELL, "/bin/sh"); }

    public Duration getEngineTimeout() { return Duration.ofSeconds(getLong(KEY_ENGINE_TIMEOUT, 600)); }

    /** Variables exportadas en el script de cada motor (claves engine.env.*). */
    public Map<String, String> getEngineEnvironment() {
        Map<String, String> env = new LinkedHashMap<>();
        for (String name : props.stringPropertyNames().stream().sorted().toList()) {
            if (name.startsWith(KEY_ENGINE_ENV_PREFIX)) {
                env.put(name.substring(KEY_ENGINE_ENV_PREFIX.length()), props.getProperty(name));
            }
        }
        return env;
    }

    // --- ENTRADAS Y SALIDAS ---
    public Path getTransformFile() { return resolveInWorkDir(props.getProperty(KEY_TRANSFORM_FILE)); }
    public String getStackName() { return props.getProperty(KEY_STACK_NAME, "stack"); }
    public String getCatalogName() { return props.getProperty(KEY_CATALOG_NAME, getStackName() + ".cat"); }
    public Path getCommonSourceList() { return resolveInWorkDir(props.getProperty(KEY_COMMON_LIST)); }
    public Path getClassificationFile() { return resolveInWorkDir(props.getProperty(KEY_CLASSIFICATION_FILE)); }

    // --- DETECTOR ---
    public double getSaturationLevel() { return getDouble(KEY_SATURATION, 65000.0); }
    public double getDefaultGain() { return getDouble(KEY_DEFAULT_GAIN, Double.NaN); }
    public double getDefaultReadNoise() { return getDouble(KEY_DEFAULT_RDNOISE, Double.NaN); }

    // --- COMBINACION ---
    public boolean isScaleFrames() { return getBoolean(KEY_SCALE_FRAMES, false); }
    public boolean isSubtractSky() { return getBoolean(KEY_SUBTRACT_SKY, true); }
    public boolean isTrim() { return getBoolean(KEY_TRIM, true); }
    public double getClipLowSigma() { return getDouble(KEY_CLIP_LOW, 3.0); }
    public double getClipHighSigma() { return getDouble(KEY_CLIP_HIGH, 3.0); }
    public int getClipIterations() { return (int) getLong(KEY_CLIP_ITERATIONS, 5); }
    public int getWorkers() { return Math.max(1, (int) getLong(KEY_WORKERS, 1)); }

    // --- DETECCION / PSF ---
    public int getPsfOrder() { return (int) getLong(KEY_PSF_ORDER, 2); }
    public int getAnalyticModel() { return (int) getLong(KEY_ANALYTIC_MODEL, 1); }
    public double getFitRadius() { return getDouble(KEY_FIT_RADIUS, 0.0); }
    public double getDetectThreshold() { return getDouble(KEY_DETECT_THRESHOLD, 4.0); }

    /** Limite del bucle interno de busqueda del motor, acotado a [1,10]. */
    public int getFindIterations() {
        long v = getLong(KEY_FIND_ITERATIONS, 3);
        return (int) Math.max(MIN_FIND_ITERATIONS, Math.min(MAX_FIND_ITERATIONS, v));
    }

    /**
     * Comprueba directorios, scripts y binarios antes de tocar ningun dato.
     */
    public void validate() {
        Path work = getWorkDir();
        if (!Files.isDirectory(work)) {
            throw new ConfigurationException(STAGE, "El directorio de trabajo no existe: " + work);
        }
        Path scripts = getScriptDir();
        if (scripts == null) {
            throw new ConfigurationException(STAGE, "Falta la clave " + KEY_SCRIPT_DIR);
        }
        if (!Files.isDirectory(scripts)) {
            throw new ConfigurationException(STAGE, "El directorio de scripts no existe: " + scripts);
        }
        requireExecutable(KEY_ENGINE_DETECT, getDetectEngine());
        requireExecutable(KEY_ENGINE_FIT, getFitEngine());
        if (resolveShell() == null) {
            throw new ConfigurationException(STAGE, "El interprete " + getShell() + " no existe o no es ejecutable ("
                    + KEY_ENGINE_SHELL + ")");
        }
        Path mch = getTransformFile();
        if (mch == null) {
            throw new ConfigurationException(STAGE, "Falta la clave " + KEY_TRANSFORM_FILE);
        }
        if (!Files.isRegularFile(mch)) {
            throw new ConfigurationException(STAGE, "No existe el fichero de transformaciones: " + mch);
        }
        if (isScaleFrames() && getCommonSourceList() == null) {
            throw new ConfigurationException(STAGE, KEY_SCALE_FRAMES + "=true requiere " + KEY_COMMON_LIST);
        }
    }

    private void requireExecutable(String key, Path engine) {
        if (engine == null) {
            throw new ConfigurationException(STAGE, "Falta la clave " + key);
        }
        if (!Files.isRegularFile(engine)) {
            throw new ConfigurationException(STAGE, "No existe el motor " + engine + " (" + key + ")");
        }
        if (!Files.isExecutable(engine)) {
            throw new ConfigurationException(STAGE, "El motor no es ejecutable: " + engine);
        }
    }

    // Un nombre sin ruta se busca en el PATH
    Path resolveShell() {
        String shell = getShell().trim();
        if (shell.isEmpty()) return null;
        Path p = Paths.get(shell);
        if (p.getNameCount() > 1 || p.isAbsolute()) {
            return Files.isRegularFile(p) && Files.isExecutable(p) ? p : null;
        }
        String path = System.getenv("PATH");
        if (path == null) return null;
        for (String d : path.split(File.pathSeparator)) {
            if (d.isEmpty()) continue;
            Path candidate = Paths.get(d).resolve(shell);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) return candidate;
        }
        return null;
    }

    // Los motores se buscan en script.dir salvo que la ruta sea absoluta
    private Path resolveEngine(String key) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return null;
        Path p = Paths.get(v.trim());
        if (p.isAbsolute() || getScriptDir() == null) return p;
        return getScriptDir().resolve(p);
    }

    private Path resolveInWorkDir(String v) {
        if (v == null || v.isBlank()) return null;
        Path p = Paths.get(v.trim());
        return p.isAbsolute() ? p : getWorkDir().resolve(p);
    }

    private double getDouble(String key, double def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(STAGE, "Valor no numerico para " + key + ": " + v, e);
        }
    }

    private long getLong(String key, long def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(STAGE, "Valor entero invalido para " + key + ": " + v, e);
        }
    }

    private boolean getBoolean(String key, boolean def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        return Boolean.parseBoolean(v.trim());
    }
}
