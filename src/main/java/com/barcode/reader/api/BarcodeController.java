package com.barcode.reader.api;

import com.barcode.reader.api.dto.DecodeResponse;
import com.barcode.reader.frame.BufferedCameraFrame;
import com.barcode.reader.frame.PixelFormat;
import com.barcode.reader.model.CropRect;
import com.barcode.reader.service.BarcodeScanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping(path = "/api/v1/barcodes", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Barcode decoding")
@Validated
public class BarcodeController {

    private final BarcodeScanService scanService;

    public BarcodeController(BarcodeScanService scanService) {
        this.scanService = scanService;
    }

    @PostMapping(value = "/decode", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Decode a barcode from an uploaded image",
            description = "Accepts any image encoding readable by ImageIO. An empty crop decodes the whole image.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Decode outcome, found=false when no symbol was detected",
                            content = @Content(schema = @Schema(implementation = DecodeResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Unreadable image or invalid crop/rotation"),
                    @ApiResponse(responseCode = "502", description = "The decoding engine reported an error")
            })
    public ResponseEntity<DecodeResponse> decode(
            @RequestPart("image") MultipartFile image,
            @RequestParam(defaultValue = "0") @PositiveOrZero int cropLeft,
            @RequestParam(defaultValue = "0") @PositiveOrZero int cropTop,
            @RequestParam(defaultValue = "0") @PositiveOrZero int cropWidth,
            @RequestParam(defaultValue = "0") @PositiveOrZero int cropHeight,
            @RequestParam(defaultValue = "0") int rotation) {
        if (image == null || image.isEmpty()) {
            throw new IllegalArgumentException("Uploaded image must not be empty");
        }
        try {
            CropRect crop = new CropRect(cropLeft, cropTop, cropWidth, cropHeight);
            return ResponseEntity.ok(DecodeResponse.from(scanService.decodeImage(image.getBytes(), crop, rotation)));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read uploaded image", ex);
        }
    }

    @PostMapping(value = "/decode/frame", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Decode a barcode from a raw camera frame",
            description = "The luma part holds the Y plane of a YUV_420_888 frame, rowStride bytes per row.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Decode outcome, found=false when no symbol was detected",
                            content = @Content(schema = @Schema(implementation = DecodeResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Inconsistent frame geometry"),
                    @ApiResponse(responseCode = "415", description = "Pixel format other than YUV_420_888"),
                    @ApiResponse(responseCode = "502", description = "The decoding engine reported an error")
            })
    public ResponseEntity<DecodeResponse> decodeFrame(
            @RequestPart("luma") MultipartFile luma,
            @RequestParam @Positive int width,
            @RequestParam @Positive int height,
            @RequestParam(required = false) @Min(1) Integer rowStride,
            @RequestParam(defaultValue = "YUV_420_888") PixelFormat format,
            @RequestParam(defaultValue = "0") @PositiveOrZero int cropLeft,
            @RequestParam(defaultValue = "0") @PositiveOrZero int cropTop,
            @RequestParam(defaultValue = "0") @PositiveOrZero int cropWidth,
            @RequestParam(defaultValue = "0") @PositiveOrZero int cropHeight,
            @RequestParam(defaultValue = "0") int rotation) {
        if (luma == null || luma.isEmpty()) {
            throw new IllegalArgumentException("Luma plane must not be empty");
        }
        try {
            CropRect crop = new CropRect(cropLeft, cropTop, cropWidth, cropHeight);
            int stride = rowStride == null ? width : rowStride;
            BufferedCameraFrame frame = BufferedCameraFrame.ofLuma(luma.getBytes(), width, height, stride, crop, rotation)
                    .withFormat(format);
            return ResponseEntity.ok(DecodeResponse.from(scanService.decodeFrame(frame)));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read uploaded frame", ex);
        }
    }
}
