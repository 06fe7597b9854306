package com.wirevizweb.dispatch.api;

import com.wirevizweb.core.format.FormatNegotiator;
import com.wirevizweb.core.format.ImageFormat;
import com.wirevizweb.core.render.Asset;
import com.wirevizweb.core.render.RenderRequest;
import com.wirevizweb.core.render.RenderService;
import com.wirevizweb.core.render.RenderedArtifact;
import com.wirevizweb.core.render.StagingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * REST controller for rendering WireViz descriptions.
 */
@RestController
public class RenderController {

    private static final Logger log = LoggerFactory.getLogger(RenderController.class);

    private final RenderService renderService;
    private final FormatNegotiator formatNegotiator;

    public RenderController(RenderService renderService, FormatNegotiator formatNegotiator) {
        this.renderService = renderService;
        this.formatNegotiator = formatNegotiator;
    }

    /**
     * POST /render: Upload a description (part {@code yml_file}) and optional
     * images (repeated part {@code images}). The {@code Accept} header picks
     * SVG (default) or PNG.
     */
    @PostMapping(path = "/render", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> render(
            @RequestParam("yml_file") MultipartFile ymlFile,
            @RequestParam(value = "images", required = false) List<MultipartFile> images,
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
        ImageFormat format = formatNegotiator.negotiate(accept);
        log.debug("POST /render: {} with {} image(s), Accept '{}' -> {}",
                ymlFile.getOriginalFilename(), images == null ? 0 : images.size(), accept, format.token());

        var request = new RenderRequest(bytesOf(ymlFile), toAssets(images), format,
                ymlFile.getOriginalFilename());
        return toResponse(renderService.render(request));
    }

    /**
     * GET /plantuml/{imagetype}/{encoded}: Render a description carried in
     * PlantUML text encoding.
     */
    @GetMapping("/plantuml/{imagetype}/{encoded}")
    public ResponseEntity<byte[]> renderPlantUml(@PathVariable("imagetype") String imageType,
                                                 @PathVariable("encoded") String encoded) {
        ImageFormat format = ImageFormat.fromToken(imageType);
        return toResponse(renderService.renderEncoded(encoded, format));
    }

    static ResponseEntity<byte[]> toResponse(RenderedArtifact artifact) {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(artifact.mimeType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(artifact.filename()).build().toString())
                .body(artifact.content());
    }

    private static List<Asset> toAssets(List<MultipartFile> images) {
        if (images == null) {
            return List.of();
        }
        var assets = new ArrayList<Asset>(images.size());
        for (MultipartFile image : images) {
            // browsers send an empty part when no file was picked
            if (image.isEmpty() && (image.getOriginalFilename() == null || image.getOriginalFilename().isBlank())) {
                continue;
            }
            assets.add(new Asset(image.getOriginalFilename(), bytesOf(image)));
        }
        return assets;
    }

    private static byte[] bytesOf(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new StagingException("Could not read uploaded part '" + file.getName() + "'", e);
        }
    }
}
