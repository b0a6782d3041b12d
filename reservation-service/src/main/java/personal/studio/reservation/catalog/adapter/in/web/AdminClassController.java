package personal.studio.reservation.catalog.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.studio.common.dto.ApiResponse;
import personal.studio.reservation.catalog.adapter.in.web.dto.ClassRequest;
import personal.studio.reservation.catalog.adapter.in.web.dto.ClassResponse;
import personal.studio.reservation.catalog.application.port.in.CreateClassUseCase;
import personal.studio.reservation.catalog.application.port.in.ManageClassUseCase;
import personal.studio.reservation.catalog.domain.model.ClassSession;
import personal.studio.reservation.user.application.port.in.ValidateUserUseCase;

/**
 * Admin Class API Controller
 * 운영자 수업 생성/수정/삭제 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin/classes")
@RequiredArgsConstructor
public class AdminClassController {

    private final CreateClassUseCase createClassUseCase;
    private final ManageClassUseCase manageClassUseCase;
    private final ValidateUserUseCase validateUserUseCase;

    /**
     * 수업 생성
     * POST /api/v1/admin/classes
     */
    @PostMapping
    public ResponseEntity<ApiResponse<ClassResponse>> createClass(
            @Valid @RequestBody ClassRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        validateUserUseCase.validateUser(userId).ensureAdministrator();
        log.info("Create class: name={}, startTime={}, totalSlots={}",
                request.name(), request.startTime(), request.totalSlots());

        ClassSession created = createClassUseCase.createClass(request.toDefinition());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Class created", ClassResponse.from(created)));
    }

    /**
     * 수업 수정
     * PUT /api/v1/admin/classes/{classId}
     */
    @PutMapping("/{classId}")
    public ResponseEntity<ApiResponse<ClassResponse>> updateClass(
            @PathVariable Long classId,
            @Valid @RequestBody ClassRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        validateUserUseCase.validateUser(userId).ensureAdministrator();
        log.info("Update class: classId={}, totalSlots={}", classId, request.totalSlots());

        ClassSession updated = manageClassUseCase.updateClass(classId, request.toDefinition());

        return ResponseEntity.ok(ApiResponse.success("Class updated", ClassResponse.from(updated)));
    }

    /**
     * 수업 삭제
     * DELETE /api/v1/admin/classes/{classId}
     */
    @DeleteMapping("/{classId}")
    public ResponseEntity<Void> deleteClass(
            @PathVariable Long classId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        validateUserUseCase.validateUser(userId).ensureAdministrator();
        log.info("Delete class: classId={}", classId);

        manageClassUseCase.deleteClass(classId);

        return ResponseEntity.noContent().build();
    }
}
