package io.github.koszti.segmentstore.api;

import io.github.koszti.segmentstore.api.dto.WriteResponse;
import io.github.koszti.segmentstore.pipeline.ReadResult;
import io.github.koszti.segmentstore.pipeline.SegmentedFileReader;
import io.github.koszti.segmentstore.pipeline.SegmentedFileWriter;
import io.github.koszti.segmentstore.pipeline.VerificationReport;
import io.github.koszti.segmentstore.pipeline.WriteResult;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@RestController
public class FileController {

    private final SegmentedFileWriter writer;
    private final SegmentedFileReader reader;

    public FileController(SegmentedFileWriter writer, SegmentedFileReader reader) {
        this.writer = writer;
        this.reader = reader;
    }

    /**
     * Store the raw request body as a new file. The body is segmented while it is read.
     */
    @PutMapping(path = "/write", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<WriteResponse> write(@RequestParam(name = "name", required = false) String name,
            InputStream body) throws IOException {
        WriteResult result = writer.write(name, body);
        return ResponseEntity.status(HttpStatus.CREATED).body(WriteResponse.from(result));
    }

    @GetMapping(path = "/read/{fileId}")
    public ResponseEntity<byte[]> read(@PathVariable("fileId") String fileId) {
        ReadResult result = reader.read(fileId);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        headers.setContentLength(result.content().length);
        headers.setContentDisposition(contentDisposition(result.file().name()));
        return new ResponseEntity<>(result.content(), headers, HttpStatus.OK);
    }

    private static ContentDisposition contentDisposition(String fileName) {
        ContentDisposition.Builder builder = ContentDisposition.attachment();
        if (StandardCharsets.US_ASCII.newEncoder().canEncode(fileName)) {
            return builder.filename(fileName).build();
        }
        return builder.filename(fileName, StandardCharsets.UTF_8).build();
    }

    @GetMapping(path = "/verify/{fileId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public VerificationReport verify(@PathVariable("fileId") String fileId) {
        return reader.verify(fileId);
    }

    @GetMapping(path = "/health", produces = MediaType.TEXT_PLAIN_VALUE)
    public String health() {
        return "OK";
    }
}
