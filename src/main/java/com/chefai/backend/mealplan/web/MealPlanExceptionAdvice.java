package com.chefai.backend.mealplan.web;

import com.chefai.backend.common.web.RequestIdFilter;
import com.chefai.backend.mealplan.controller.MealPlanController;
import com.chefai.backend.mealplan.controller.RecipeController;
import com.chefai.backend.mealplan.dto.MealPlanErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice(assignableTypes = {
        MealPlanController.class,
        RecipeController.class
})
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MealPlanExceptionAdvice {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<MealPlanErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(err(code, e, req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<MealPlanErrorResponse> handleInvalid(MethodArgumentNotValidException e, HttpServletRequest req) {
        var fe = e.getBindingResult().getFieldError();
        String msg = (fe == null) ? "BAD_REQUEST" : fe.getField() + " " + fe.getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new MealPlanErrorResponse("BAD_REQUEST", msg, rid(req)));
    }

    /**
     * JSON 解析失敗；mealSlot 不合法時 Jackson 會把 MEAL_SLOT_INVALID 包在 cause 裡
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<MealPlanErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        String code = "BAD_REQUEST";
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof IllegalArgumentException iae && "MEAL_SLOT_INVALID".equals(iae.getMessage())) {
                code = "MEAL_SLOT_INVALID";
                break;
            }
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new MealPlanErrorResponse(code, code, rid(req)));
    }

    @ExceptionHandler(ActivePlanExistsException.class)
    public ResponseEntity<MealPlanErrorResponse> handleActivePlan(ActivePlanExistsException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(err("ACTIVE_MEAL_PLAN_EXISTS", e, req));
    }

    /**
     * ✅ 產出不足一天一道：整個 plan 不可用，附上缺了哪些 slot
     */
    @ExceptionHandler(ViabilityFailureException.class)
    public ResponseEntity<MealPlanErrorResponse> handleViability(ViabilityFailureException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new MealPlanErrorResponse(
                        "MEAL_PLAN_NOT_VIABLE",
                        "Only " + e.produced() + " recipe(s) generated for " + e.days() + " day(s)",
                        rid(req),
                        null,
                        e.missingSlots()
                ));
    }

    @ExceptionHandler(SlotRegenerationException.class)
    public ResponseEntity<MealPlanErrorResponse> handleRegen(SlotRegenerationException e, HttpServletRequest req) {
        String reason = (e.reason() == null) ? null : e.reason().name();
        String msg = (e.detailCode() == null) ? "SLOT_REGENERATION_FAILED" : e.detailCode();
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new MealPlanErrorResponse("SLOT_REGENERATION_FAILED", msg, rid(req), reason, null));
    }

    @ExceptionHandler(RecipeNotFoundException.class)
    public ResponseEntity<MealPlanErrorResponse> handleNotFound(RecipeNotFoundException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(err("RECIPE_NOT_FOUND", e, req));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<MealPlanErrorResponse> handleStatus(ResponseStatusException e, HttpServletRequest req) {
        HttpStatusCode status = e.getStatusCode();
        String code = norm(e.getReason(), "ERROR");
        return ResponseEntity.status(status).body(new MealPlanErrorResponse(code, code, rid(req)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<MealPlanErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("meal_plan_unhandled rid={}", rid(req), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new MealPlanErrorResponse("INTERNAL_ERROR", "INTERNAL_ERROR", rid(req)));
    }

    // ===== helpers =====

    private static MealPlanErrorResponse err(String code, Throwable e, HttpServletRequest req) {
        return new MealPlanErrorResponse(code, safeMsgOrCode(e, code), rid(req));
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.current(req);
    }

    private static String norm(String msg, String fallback) {
        if (msg == null) return fallback;
        String c = msg.trim();
        return c.isEmpty() ? fallback : c;
    }

    private static String safeMsgOrCode(Throwable t, String code) {
        String m = t.getMessage();
        if (m == null || m.isBlank()) return code;
        return m;
    }
}
