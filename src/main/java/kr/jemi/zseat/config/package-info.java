@ApplicationModule(type = ApplicationModule.Type.OPEN)
package kr.jemi.zseat.config;

import org.springframework.modulith.ApplicationModule;
