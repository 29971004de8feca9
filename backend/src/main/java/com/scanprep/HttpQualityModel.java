package com.scanprep;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Quality model served over HTTP. The image is POSTed as PNG bytes and the
 * service answers {@code {"score": <number>}}.
 */
public class HttpQualityModel implements QualityModel {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String url;

    public HttpQualityModel(RestTemplate restTemplate, ObjectMapper objectMapper, String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigException("Quality model URL is not configured");
        }
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.url = url;
    }

    @Override
    public double assess(BufferedImage image) throws IOException {
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(image, "png", png);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.IMAGE_PNG);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        String body = restTemplate.postForObject(url, new HttpEntity<>(png.toByteArray(), headers), String.class);
        return parseResponse(body);
    }

    double parseResponse(String body) throws IOException {
        if (body == null || body.isBlank()) {
            throw new IOException("Empty response from quality service");
        }
        JsonNode score = objectMapper.readTree(body).path("score");
        if (!score.isNumber()) {
            throw new IOException("Quality service response has no numeric score: " + body);
        }
        return score.asDouble();
    }
}
