package org.learningjava.blockprog.infrastructure.adapter.in.web;

import org.learningjava.blockprog.application.usecase.ParseOutcome;
import org.learningjava.blockprog.application.usecase.ParseProgramUseCase;
import org.learningjava.blockprog.config.BlockProgProperties;
import org.learningjava.blockprog.domain.exception.ProgramParseException;
import org.learningjava.blockprog.domain.model.program.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/programs")
public class ProgramController {

    private static final Logger log = LoggerFactory.getLogger(ProgramController.class);

    private final ParseProgramUseCase useCase;
    private final BlockProgProperties props;

    public ProgramController(ParseProgramUseCase useCase, BlockProgProperties props) {
        this.useCase = useCase;
        this.props = props;
    }

    // --- Single document in the request body
    @PostMapping(
            consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE, MediaType.TEXT_PLAIN_VALUE},
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ProgramDTO parse(@RequestBody String xml) throws ProgramParseException {
        checkSize(xml == null ? 0 : xml.length(), "request body");
        Program program = useCase.parse(xml);
        return ProgramDTO.from(program);
    }

    // --- Browser upload, one outcome per file
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ProgramDTO.OutcomeDTO> upload(
            @RequestParam(value = "files", required = false) List<MultipartFile> files) throws IOException {

        if (files == null || files.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No files provided");
        }
        String ext = props.getScan().getExtension().toLowerCase(Locale.ROOT);
        for (MultipartFile f : files) {
            String name = f.getOriginalFilename();
            if (name == null || !name.toLowerCase(Locale.ROOT).endsWith(ext)) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported file: " + name);
            }
        }

        List<ProgramDTO.OutcomeDTO> out = new ArrayList<>();
        for (MultipartFile f : files) {
            // bytes go to the parser as-is so the document's own encoding declaration applies
            byte[] content = f.getBytes();
            checkSize(content.length, f.getOriginalFilename());
            ParseOutcome outcome;
            try {
                outcome = ParseOutcome.success(f.getOriginalFilename(), useCase.parse(content));
            } catch (ProgramParseException e) {
                log.warn("Upload {} rejected: [{}] {}", f.getOriginalFilename(), e.code(), e.getMessage());
                outcome = ParseOutcome.failure(f.getOriginalFilename(), e);
            }
            out.add(ProgramDTO.OutcomeDTO.from(outcome));
        }
        return out;
    }

    // --- Server/container directory path
    @PostMapping(value = "/scan", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ProgramDTO.OutcomeDTO> scan(@RequestParam String rootDir) {
        if (rootDir.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "rootDir is blank");
        }
        return useCase.parseDirectory(rootDir).stream().map(ProgramDTO.OutcomeDTO::from).toList();
    }

    private void checkSize(int length, String what) {
        int max = props.getWeb().getMaxDocumentChars();
        if (length > max) {
            throw new ResponseStatusException(HttpStatus.PAYLOAD_TOO_LARGE,
                    "Document in " + what + " exceeds " + max + " characters");
        }
    }
}
