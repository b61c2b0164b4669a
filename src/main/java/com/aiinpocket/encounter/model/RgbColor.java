package com.aiinpocket.encounter.model;

/**
 * 顯示用 RGB 顏色，各通道 0-255。
 */
public record RgbColor(int red, int green, int blue) {

    public static final RgbColor ENEMY_DEFAULT = new RgbColor(200, 80, 80);
    public static final RgbColor ALLY_DEFAULT = new RgbColor(100, 150, 255);

    /**
     * 各通道分別乘上倍率，截斷後上限 255。
     */
    public RgbColor scale(double redFactor, double greenFactor, double blueFactor) {
        return new RgbColor(
                Math.min(255, (int) (red * redFactor)),
                Math.min(255, (int) (green * greenFactor)),
                Math.min(255, (int) (blue * blueFactor)));
    }
}
