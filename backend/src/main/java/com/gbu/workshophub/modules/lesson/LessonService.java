package com.gbu.workshophub.modules.lesson;

import com.gbu.workshophub.exception.BusinessException;
import com.gbu.workshophub.exception.ResourceNotFoundException;
import com.gbu.workshophub.modules.lesson.dto.*;
import com.gbu.workshophub.modules.points.PointsService;
import com.gbu.workshophub.modules.points.UserPoints;
import com.gbu.workshophub.modules.user.User;
import com.gbu.workshophub.modules.user.UserService;
import com.gbu.workshophub.modules.workshop.Workshop;
import com.gbu.workshophub.modules.workshop.WorkshopService;
import com.gbu.workshophub.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class LessonService {

    private final LessonRepository lessonRepository;
    private final LessonMaterialRepository materialRepository;
    private final WorkshopService workshopService;
    private final UserService userService;
    private final PointsService pointsService;
    private final SecurityUtils securityUtils;

    @Transactional
    public LessonDto createLesson(UUID workshopId, CreateLessonRequest request) {
        Workshop workshop = workshopService.findWorkshop(workshopId);
        workshopService.requireOwner(workshop, "add lessons");

        Lesson lesson = Lesson.builder()
                .workshop(workshop)
                .title(requireText(request.getTitle(), "Title"))
                .description(request.getDescription())
                .content(request.getContent())
                .orderIndex(request.getOrderIndex() != null ? request.getOrderIndex() : 0)
                .points(request.getPoints() != null ? request.getPoints() : 10)
                .build();

        lesson = lessonRepository.save(lesson);
        log.info("Lesson {} added to workshop {}", lesson.getId(), workshopId);
        return toDto(lesson, List.of());
    }

    @Transactional(readOnly = true)
    public List<LessonDto> getLessons(UUID workshopId) {
        workshopService.findWorkshop(workshopId);
        List<Lesson> lessons = lessonRepository.findByWorkshopIdOrderByOrderIndexAscCreatedAtAsc(workshopId);
        if (lessons.isEmpty()) {
            return List.of();
        }

        Map<UUID, List<MaterialDto>> materials = materialRepository
                .findByLessonIds(lessons.stream().map(Lesson::getId).collect(Collectors.toList())).stream()
                .map(this::toMaterialDto)
                .collect(Collectors.groupingBy(MaterialDto::getLessonId));

        return lessons.stream()
                .map(l -> toDto(l, materials.getOrDefault(l.getId(), List.of())))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public LessonDto getLesson(UUID lessonId) {
        return toDto(findLesson(lessonId));
    }

    @Transactional
    public LessonDto updateLesson(UUID lessonId, UpdateLessonRequest request) {
        Lesson lesson = findLesson(lessonId);
        workshopService.requireOwner(lesson.getWorkshop(), "update lessons");

        if (request.getTitle() != null)
            lesson.setTitle(requireText(request.getTitle(), "Title"));
        if (request.getDescription() != null)
            lesson.setDescription(request.getDescription());
        if (request.getContent() != null)
            lesson.setContent(request.getContent());
        if (request.getOrderIndex() != null)
            lesson.setOrderIndex(request.getOrderIndex());
        if (request.getPoints() != null)
            lesson.setPoints(request.getPoints());

        return toDto(lessonRepository.saveAndFlush(lesson));
    }

    @Transactional
    public void deleteLesson(UUID lessonId) {
        Lesson lesson = findLesson(lessonId);
        workshopService.requireOwner(lesson.getWorkshop(), "delete lessons");
        lessonRepository.delete(lesson);
        log.info("Lesson {} deleted", lessonId);
    }

    /** Awards the lesson's points once and refreshes global ranks. */
    @Transactional
    public LessonCompletionDto completeLesson(UUID lessonId) {
        Lesson lesson = findLesson(lessonId);
        User user = userService.findUser(securityUtils.getCurrentUserId());

        UserPoints points = pointsService.awardLesson(user, lesson);
        pointsService.recomputeRankings();

        return new LessonCompletionDto("Lesson completed", lesson.getPoints(), points.getTotalPoints());
    }

    // ── Materials ────────────────────────────────────────────────────────────

    @Transactional
    public MaterialDto addMaterial(UUID lessonId, CreateMaterialRequest request) {
        Lesson lesson = findLesson(lessonId);
        workshopService.requireOwner(lesson.getWorkshop(), "add materials");

        LessonMaterial.MaterialType type = LessonMaterial.MaterialType.fromValue(request.getMaterialType().trim())
                .orElseThrow(() -> new BusinessException("material_type must be one of: video, pdf, link"));

        LessonMaterial material = LessonMaterial.builder()
                .lesson(lesson)
                .materialType(type)
                .title(requireText(request.getTitle(), "Title"))
                .url(requireText(request.getUrl(), "URL"))
                .fileSize(request.getFileSize())
                .duration(request.getDuration())
                .build();

        return toMaterialDto(materialRepository.save(material));
    }

    @Transactional
    public void deleteMaterial(UUID materialId) {
        LessonMaterial material = materialRepository.findByIdWithWorkshop(materialId)
                .orElseThrow(() -> new ResourceNotFoundException("Material", materialId.toString()));
        workshopService.requireOwner(material.getLesson().getWorkshop(), "delete materials");
        materialRepository.delete(material);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Lesson findLesson(UUID lessonId) {
        return lessonRepository.findByIdWithWorkshop(lessonId)
                .orElseThrow(() -> new ResourceNotFoundException("Lesson", lessonId.toString()));
    }

    private static String requireText(String value, String field) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw new BusinessException(field + " cannot be empty");
        }
        return trimmed;
    }

    private LessonDto toDto(Lesson lesson) {
        List<MaterialDto> materials = materialRepository.findByLessonIdOrderByCreatedAtAsc(lesson.getId()).stream()
                .map(this::toMaterialDto)
                .collect(Collectors.toList());
        return toDto(lesson, materials);
    }

    private LessonDto toDto(Lesson lesson, List<MaterialDto> materials) {
        return LessonDto.builder()
                .id(lesson.getId())
                .workshopId(lesson.getWorkshop().getId())
                .title(lesson.getTitle())
                .description(lesson.getDescription())
                .content(lesson.getContent())
                .orderIndex(lesson.getOrderIndex())
                .points(lesson.getPoints())
                .materials(materials)
                .createdAt(lesson.getCreatedAt())
                .updatedAt(lesson.getUpdatedAt())
                .build();
    }

    private MaterialDto toMaterialDto(LessonMaterial m) {
        return MaterialDto.builder()
                .id(m.getId())
                .lessonId(m.getLesson().getId())
                .materialType(m.getMaterialType())
                .title(m.getTitle())
                .url(m.getUrl())
                .fileSize(m.getFileSize())
                .duration(m.getDuration())
                .createdAt(m.getCreatedAt())
                .build();
    }
}
