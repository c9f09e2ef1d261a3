package uk.gegc.quizengine.features.question.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.quizengine.features.question.api.dto.QuestionDto;
import uk.gegc.quizengine.features.question.application.QuestionCatalogService;

import java.util.List;

@Tag(name = "Questions", description = "Browse the question catalog; answer keys are never returned")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
public class QuestionController {

    private final QuestionCatalogService questionCatalogService;

    @Operation(summary = "List questions", description = "Filters combine; results keep catalog order.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matching questions"),
            @ApiResponse(responseCode = "400", description = "Unknown difficulty or out-of-range paging",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Question catalog unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/questions")
    public ResponseEntity<List<QuestionDto>> listQuestions(
            @Parameter(description = "Category, matched ignoring case", example = "Cryptography")
            @RequestParam(required = false) String category,
            @Parameter(description = "easy, medium or hard", example = "easy")
            @RequestParam(required = false) String difficulty,
            @Parameter(description = "Questions carrying any of these tags", example = "hashing")
            @RequestParam(required = false) List<String> tags,
            @Parameter(description = "Maximum number of questions", example = "10")
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @Parameter(description = "Number of matching questions to skip", example = "0")
            @RequestParam(defaultValue = "0") @Min(0) int skip
    ) {
        return ResponseEntity.ok(questionCatalogService.listQuestions(category, difficulty, tags, limit, skip));
    }

    @Operation(summary = "Get a question")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question found",
                    content = @Content(schema = @Schema(implementation = QuestionDto.class))),
            @ApiResponse(responseCode = "404", description = "No question with this id",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/questions/{questionId}")
    public ResponseEntity<QuestionDto> getQuestion(@PathVariable String questionId) {
        return ResponseEntity.ok(questionCatalogService.getQuestion(questionId));
    }

    @Operation(summary = "List categories", description = "Distinct categories, sorted ignoring case.")
    @GetMapping("/categories")
    public ResponseEntity<List<String>> getCategories() {
        return ResponseEntity.ok(questionCatalogService.getCategories());
    }

    @Operation(summary = "List tags", description = "Distinct tags, sorted.")
    @GetMapping("/tags")
    public ResponseEntity<List<String>> getTags() {
        return ResponseEntity.ok(questionCatalogService.getTags());
    }
}
