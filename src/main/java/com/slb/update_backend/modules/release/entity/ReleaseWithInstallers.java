package com.slb.update_backend.modules.release.entity;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ReleaseWithInstallers {

    private Release release;

    private List<Installer> installers = new ArrayList<>();
}
