package com.stackfit.main;

import com.stackfit.engine.SystemProcessRunner;
import com.stackfit.error.PipelineException;
import com.stackfit.model.PipelineConfig;
import com.stackfit.model.StarCatalog;
import com.stackfit.service.StackAndFitPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

public class StackFitApp {

    private static final Logger log = LoggerFactory.getLogger(StackFitApp.class);

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Uso: stackfit <config.properties>");
            System.exit(2);
        }
        try {
            PipelineConfig config = PipelineConfig.load(Paths.get(args[0]));
            StarCatalog catalog = new StackAndFitPipeline(config, new SystemProcessRunner()).run();
            log.info("Terminado: {} estrellas", catalog.size());
        } catch (PipelineException e) {
            // los ficheros parciales quedan en su sitio para reanudar
            log.error("Etapa '{}' fallida: {}", e.getStage(), e.getMessage(), e);
            System.exit(1);
        }
    }
}
