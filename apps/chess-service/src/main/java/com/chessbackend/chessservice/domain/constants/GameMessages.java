package com.chessbackend.chessservice.domain.constants;

/**
 * 国际象棋对局相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 *
 * 使用示例：
 *   String reason = GameMessages.formatWrongTurn("白方");
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 坐标/请求格式 ==========

    /** 坐标格式不合法 */
    public static final String INVALID_SQUARE = "坐标格式不合法：%s（应为代数记法，如 e2）";

    /** 起点终点相同 */
    public static final String SAME_SQUARE = "起点与终点不能相同";

    public static String formatInvalidSquare(String square) {
        return String.format(INVALID_SQUARE, square);
    }

    // ========== 对局状态 ==========

    /** 对局不在进行中 */
    public static final String GAME_NOT_IN_PROGRESS = "对局不在进行中";

    /** 起点没有棋子 */
    public static final String EMPTY_SOURCE = "%s 处没有棋子";

    /** 未轮到该方走棋 */
    public static final String WRONG_TURN = "未轮到该方走棋（当前应为 %s）";

    /** 吃自己的棋子 */
    public static final String FRIENDLY_CAPTURE = "不能吃己方棋子";

    public static String formatEmptySource(String square) {
        return String.format(EMPTY_SOURCE, square);
    }

    public static String formatWrongTurn(String currentSide) {
        return String.format(WRONG_TURN, currentSide);
    }

    // ========== 走法 ==========

    /** 不符合该棋子的走法 */
    public static final String ILLEGAL_PATTERN = "%s不能这样走";

    /** 直线/斜线路径被挡 */
    public static final String PATH_BLOCKED = "路径被挡住";

    /** 兵只能直走（吃子除外） */
    public static final String ILLEGAL_PAWN_MOVE = "兵的走法不合法（不吃子时只能向前直走）";

    /** 兵只能斜前方一格吃子 */
    public static final String ILLEGAL_PAWN_CAPTURE = "兵只能吃斜前方一格的棋子";

    /** 兵前方被挡 */
    public static final String PAWN_BLOCKED = "兵的前进路线被挡住";

    public static String formatIllegalPattern(String pieceName) {
        return String.format(ILLEGAL_PATTERN, pieceName);
    }

    // ========== 升变 ==========

    /** 升变编码非法 */
    public static final String INVALID_PROMOTION = "升变棋子不合法，只能是 q、r、b、n 之一";

    /** 未到底线不能升变 */
    public static final String PROMOTION_NOT_ALLOWED = "兵到达底线时才能升变";
}
