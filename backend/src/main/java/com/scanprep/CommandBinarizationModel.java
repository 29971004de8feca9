package com.scanprep;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Binarization model run as a subprocess on temporary PNG files, e.g.
 * {@code sbb_binarize --patches -m /models/sbb {input} {output}}.
 */
public class CommandBinarizationModel implements BinarizationModel {

    static final String INPUT = "{input}";
    static final String OUTPUT = "{output}";

    private final String commandTemplate;
    private final Duration timeout;

    public CommandBinarizationModel(String commandTemplate, Duration timeout) {
        ExternalCommand.expand(commandTemplate, Map.of(INPUT, "in", OUTPUT, "out"));
        this.commandTemplate = commandTemplate;
        this.timeout = timeout;
    }

    @Override
    public BufferedImage binarize(BufferedImage gray) throws IOException, InterruptedException {
        Path input = Files.createTempFile("scanprep-bin-in-", ".png");
        Path output = Files.createTempFile("scanprep-bin-out-", ".png");
        try {
            ImageIO.write(gray, "png", input.toFile());
            List<String> command = ExternalCommand.expand(commandTemplate,
                    Map.of(INPUT, input.toString(), OUTPUT, output.toString()));
            ExternalCommand.run(command, timeout);

            BufferedImage result = ImageIO.read(output.toFile());
            if (result == null) {
                throw new IOException("Binarization command wrote no readable image");
            }
            return result;
        } finally {
            Files.deleteIfExists(input);
            Files.deleteIfExists(output);
        }
    }
}
