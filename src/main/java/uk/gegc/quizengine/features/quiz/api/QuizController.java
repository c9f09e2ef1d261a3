package uk.gegc.quizengine.features.quiz.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.quizengine.features.quiz.api.dto.*;
import uk.gegc.quizengine.features.quiz.application.QuizService;

import java.util.List;

@Tag(name = "Quizzes", description = "Create quiz sessions, answer questions and review results")
@RestController
@RequestMapping("/api/v1/quizzes")
@RequiredArgsConstructor
@Validated
public class QuizController {

    static final String USER_HEADER = "X-User-Id";

    private final QuizService quizService;

    @Operation(summary = "Create a chapter quiz",
            description = "Shuffles the questions of one chapter. Uses every available question when fewer than requested exist.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session created",
                    content = @Content(schema = @Schema(implementation = QuizCreatedDto.class))),
            @ApiResponse(responseCode = "422", description = "The chapter has no questions",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/chapter")
    public ResponseEntity<QuizCreatedDto> createChapterQuiz(
            @RequestBody @Valid ChapterQuizRequest request,
            @Parameter(description = "Id of the quiz taker; results of anonymous sessions are not recorded")
            @RequestHeader(name = USER_HEADER, required = false) String userId
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(quizService.createChapterQuiz(request, userId));
    }

    @Operation(summary = "Create a category quiz")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session created",
                    content = @Content(schema = @Schema(implementation = QuizCreatedDto.class))),
            @ApiResponse(responseCode = "422", description = "No questions match the category and difficulty",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/category")
    public ResponseEntity<QuizCreatedDto> createCategoryQuiz(
            @RequestBody @Valid CategoryQuizRequest request,
            @RequestHeader(name = USER_HEADER, required = false) String userId
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(quizService.createCategoryQuiz(request, userId));
    }

    @Operation(summary = "Create a random quiz",
            description = "Samples without replacement from the questions matching the optional sections and difficulty.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session created",
                    content = @Content(schema = @Schema(implementation = QuizCreatedDto.class))),
            @ApiResponse(responseCode = "422", description = "No questions match the filters",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/random")
    public ResponseEntity<QuizCreatedDto> createRandomQuiz(
            @RequestBody(required = false) @Valid RandomQuizRequest request,
            @RequestHeader(name = USER_HEADER, required = false) String userId
    ) {
        RandomQuizRequest effective = request != null ? request : new RandomQuizRequest(null, null, null);
        return ResponseEntity.status(HttpStatus.CREATED).body(quizService.createRandomQuiz(effective, userId));
    }

    @Operation(summary = "Create a practice test",
            description = "Exam simulation with an automatic, fixed or unlimited time limit.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session created",
                    content = @Content(schema = @Schema(implementation = QuizCreatedDto.class))),
            @ApiResponse(responseCode = "422", description = "No questions match the filters",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/practice-test")
    public ResponseEntity<QuizCreatedDto> createPracticeTest(
            @RequestBody(required = false) @Valid PracticeTestRequest request,
            @RequestHeader(name = USER_HEADER, required = false) String userId
    ) {
        PracticeTestRequest effective = request != null ? request : new PracticeTestRequest(null, null, null, null);
        return ResponseEntity.status(HttpStatus.CREATED).body(quizService.createPracticeTest(effective, userId));
    }

    @Operation(summary = "List chapters", description = "Every chapter in the catalog with its question count.")
    @GetMapping("/sections")
    public ResponseEntity<List<SectionSummaryDto>> getSections() {
        return ResponseEntity.ok(quizService.getSections());
    }

    @Operation(summary = "Get one chapter", description = "Question counts of the chapter by category and difficulty.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Chapter found",
                    content = @Content(schema = @Schema(implementation = SectionDetailDto.class))),
            @ApiResponse(responseCode = "404", description = "The chapter has no questions",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/sections/{section}")
    public ResponseEntity<SectionDetailDto> getSection(
            @Parameter(description = "Chapter number", example = "3")
            @PathVariable int section
    ) {
        return ResponseEntity.ok(quizService.getSection(section));
    }

    @Operation(summary = "Catalog statistics")
    @GetMapping("/catalog/stats")
    public ResponseEntity<CatalogStatsDto> getCatalogStats() {
        return ResponseEntity.ok(quizService.getCatalogStats());
    }

    @Operation(summary = "Get the question at the session pointer")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question returned"),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session already completed or expired",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{sessionId}/questions/current")
    public ResponseEntity<QuizQuestionDto> getCurrentQuestion(@PathVariable String sessionId) {
        return ResponseEntity.ok(quizService.getCurrentQuestion(sessionId));
    }

    @Operation(summary = "Get the question at a position", description = "Does not move the session pointer.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question returned"),
            @ApiResponse(responseCode = "400", description = "Position out of range",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Session not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{sessionId}/questions/{index}")
    public ResponseEntity<QuizQuestionDto> getQuestion(
            @PathVariable String sessionId,
            @Parameter(description = "Zero-based position", example = "0")
            @PathVariable @Min(0) int index
    ) {
        return ResponseEntity.ok(quizService.getQuizQuestion(sessionId, index));
    }

    @Operation(summary = "Move to the next or previous question",
            description = "Stays on the first or last question instead of failing at either end.")
    @PostMapping("/{sessionId}/navigation")
    public ResponseEntity<QuizQuestionDto> navigate(
            @PathVariable String sessionId,
            @RequestBody @Valid NavigationRequest request
    ) {
        return ResponseEntity.ok(quizService.navigate(sessionId, request.direction()));
    }

    @Operation(summary = "Submit an answer",
            description = "Re-submitting a position replaces the earlier answer. Answering the last open question completes the session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer graded",
                    content = @Content(schema = @Schema(implementation = AnswerSubmissionDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid position or payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Session already completed or expired",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/{sessionId}/answers")
    public ResponseEntity<AnswerSubmissionDto> submitAnswer(
            @PathVariable String sessionId,
            @RequestBody @Valid AnswerSubmissionRequest request
    ) {
        AnswerSubmissionDto dto = quizService.submitQuizAnswer(
                sessionId, request.index(), request.value(), request.elapsedSeconds());
        return ResponseEntity.ok(dto);
    }

    @Operation(summary = "Get results", description = "Completes a still-active session before returning its score.")
    @GetMapping("/{sessionId}/results")
    public ResponseEntity<QuizResultDto> getResults(@PathVariable String sessionId) {
        return ResponseEntity.ok(quizService.getQuizResults(sessionId));
    }

    @Operation(summary = "Review wrong answers", description = "Available once the session is completed or expired.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Wrong answers in position order"),
            @ApiResponse(responseCode = "409", description = "Session still active",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{sessionId}/review")
    public ResponseEntity<List<WrongAnswerReviewDto>> getReview(@PathVariable String sessionId) {
        return ResponseEntity.ok(quizService.getWrongQuestionsReview(sessionId));
    }

    @Operation(summary = "Delete a session", description = "Does nothing when the session no longer exists.")
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable String sessionId) {
        quizService.cleanupQuizSession(sessionId);
        return ResponseEntity.noContent().build();
    }
}
